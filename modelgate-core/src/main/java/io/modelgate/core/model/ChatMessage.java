package io.modelgate.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One turn of a conversation. {@code media} holds image references (data URIs or URLs)
 * attached to a user turn; backends decide how to encode them.
 */
public record ChatMessage(
    MessageRole role,
    String content,
    String toolCallId,
    List<ToolCall> toolCalls,
    List<String> media
) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        media = media == null ? List.of() : List.copyOf(media);
    }

    public ChatMessage(MessageRole role, String content, String toolCallId, List<ToolCall> toolCalls) {
        this(role, content, toolCallId, toolCalls, List.of());
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, null, List.of());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, null, List.of());
    }

    public static ChatMessage user(String content, List<String> media) {
        return new ChatMessage(MessageRole.USER, content, null, List.of(), media);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, List.of());
    }

    public static ChatMessage assistantWithToolCalls(String content, List<ToolCall> toolCalls) {
        return new ChatMessage(MessageRole.ASSISTANT, content, null, toolCalls);
    }

    public static ChatMessage tool(String content, String toolCallId) {
        return new ChatMessage(MessageRole.TOOL, content, toolCallId, List.of());
    }

    public String roleValue() {
        return role.name().toLowerCase(Locale.ROOT);
    }
}
