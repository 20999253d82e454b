package io.modelgate.core.backend;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Sampling parameters for one completion. Null fields mean "not set" and never override a
 * lower layer when configs are stacked with {@link #overlay(GenerationConfig)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationConfig(
    @JsonAlias({"max_tokens"}) Integer maxTokens,
    Double temperature,
    @JsonAlias({"top_k"}) Integer topK,
    @JsonAlias({"top_p"}) Double topP,
    @JsonAlias({"frequency_penalty"}) Double frequencyPenalty
) {
    private static final GenerationConfig EMPTY = new GenerationConfig(null, null, null, null, null);

    public static GenerationConfig defaults() {
        return new GenerationConfig(8192, 0.7, 50, 0.7, 0.5);
    }

    public static GenerationConfig empty() {
        return EMPTY;
    }

    public GenerationConfig overlay(GenerationConfig override) {
        if (override == null) {
            return this;
        }
        return new GenerationConfig(
            override.maxTokens != null ? override.maxTokens : maxTokens,
            override.temperature != null ? override.temperature : temperature,
            override.topK != null ? override.topK : topK,
            override.topP != null ? override.topP : topP,
            override.frequencyPenalty != null ? override.frequencyPenalty : frequencyPenalty
        );
    }

    @JsonIgnore
    public boolean isEmpty() {
        return maxTokens == null && temperature == null && topK == null && topP == null && frequencyPenalty == null;
    }
}
