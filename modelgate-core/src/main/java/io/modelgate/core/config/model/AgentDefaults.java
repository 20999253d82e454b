package io.modelgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.modelgate.core.backend.GenerationConfig;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentDefaults(
    ModelsConfig models,
    @JsonAlias({"max_tokens"}) int maxTokens,
    double temperature,
    @JsonAlias({"top_k"}) int topK,
    @JsonAlias({"top_p"}) double topP,
    @JsonAlias({"frequency_penalty"}) double frequencyPenalty,
    boolean auto,
    boolean max
) {

    public static AgentDefaults defaults() {
        return new AgentDefaults(ModelsConfig.defaults(), 8192, 0.7, 50, 0.7, 0.5, true, false);
    }

    public GenerationConfig generation() {
        return new GenerationConfig(maxTokens, temperature, topK, topP, frequencyPenalty);
    }
}
