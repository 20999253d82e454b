package io.modelgate.core.backend;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Objects;

/**
 * Capabilities of one model served by a backend. In config files a descriptor may be written
 * as a bare model id, which yields {@link #defaults(String)}.
 */
@JsonDeserialize(using = ModelDescriptorDeserializer.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelDescriptor(
    String id,
    boolean vision,
    boolean reasoning,
    boolean toolUse,
    Tier tier,
    GenerationConfig generation
) {

    public ModelDescriptor {
        Objects.requireNonNull(id, "id must not be null");
        tier = tier == null ? Tier.MEDIUM : tier;
        generation = generation == null || generation.isEmpty() ? null : generation;
    }

    public ModelDescriptor(String id, boolean vision, boolean reasoning, boolean toolUse, Tier tier) {
        this(id, vision, reasoning, toolUse, tier, null);
    }

    public static ModelDescriptor defaults(String id) {
        return new ModelDescriptor(id, false, false, true, Tier.MEDIUM);
    }

    public GenerationConfig generationOrEmpty() {
        return generation == null ? GenerationConfig.empty() : generation;
    }
}
