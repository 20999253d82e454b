package io.modelgate.core.backend;

import io.modelgate.core.model.ChatMessage;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A chat-completion provider the gateway can dispatch to.
 */
public interface Backend {

    /**
     * Runs one completion.
     *
     * @param modelId model to use, or {@code null} for {@link #defaultModel()}
     * @param config per-call sampling overrides, may be {@code null}
     * @throws BackendException on transport failure, timeout or a non-2xx reply
     */
    LlmResponse chat(
        List<ChatMessage> messages,
        List<Map<String, Object>> tools,
        String modelId,
        GenerationConfig config
    );

    String defaultModel();

    /**
     * Asks the backend which models it currently serves.
     *
     * @return the live model ids, or {@link Optional#empty()} when the backend could not be asked.
     *     An empty list means the backend answered but has no models.
     */
    Optional<List<String>> listModels();

    ModelDescriptor capabilitiesOf(String modelId);
}
