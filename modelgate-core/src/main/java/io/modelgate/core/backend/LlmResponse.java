package io.modelgate.core.backend;

import io.modelgate.core.model.ToolCall;
import java.util.List;
import java.util.Map;

/**
 * A completion result. {@code usedBackend}, {@code usedModel} and {@code usedTier} are stamped by
 * the gateway and can differ from what the caller asked for after failover.
 */
public record LlmResponse(
    String content,
    List<ToolCall> toolCalls,
    Map<String, Object> usage,
    String usedBackend,
    String usedModel,
    Tier usedTier
) {
    public LlmResponse {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public LlmResponse(String content, List<ToolCall> toolCalls, Map<String, Object> usage) {
        this(content, toolCalls, usage, null, null, null);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public LlmResponse withRoute(String backend, String model, Tier tier) {
        return new LlmResponse(content, toolCalls, usage, backend, model, tier);
    }
}
