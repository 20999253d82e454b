package io.modelgate.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelsConfig(
    String chat,
    @JsonAlias({"check"}) String intent,
    String vision,
    String coder
) {

    public static ModelsConfig defaults() {
        return new ModelsConfig("ollama/qwen3", null, null, null);
    }
}
