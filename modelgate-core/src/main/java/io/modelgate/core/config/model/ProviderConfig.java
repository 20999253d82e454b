package io.modelgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.modelgate.core.backend.ModelDescriptor;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * One OpenAI-compatible endpoint. The first entry of {@code models} is the backend's default model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"base_url", "apiBase", "api_base"}) String baseUrl,
    @JsonAlias({"api_key"}) String apiKey,
    List<ModelDescriptor> models,
    Integer priority,
    @JsonAlias({"timeout_seconds"}) Integer timeoutSeconds,
    @JsonAlias({"max_attempts"}) Integer maxAttempts,
    @JsonAlias({"extra_headers"}) Map<String, String> extraHeaders
) {
    public static final int DEFAULT_PRIORITY = 100;

    public ProviderConfig {
        models = models == null ? List.of() : List.copyOf(models);
        extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
    }

    public static ProviderConfig local(String baseUrl, String... models) {
        return new ProviderConfig(
            baseUrl,
            "",
            Arrays.stream(models).map(ModelDescriptor::defaults).toList(),
            DEFAULT_PRIORITY,
            60,
            1,
            Map.of()
        );
    }

    public boolean configured() {
        return baseUrl != null && !baseUrl.isBlank();
    }

    public int priorityOrDefault() {
        return priority == null ? DEFAULT_PRIORITY : priority;
    }
}
