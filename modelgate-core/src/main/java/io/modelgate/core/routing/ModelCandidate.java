package io.modelgate.core.routing;

import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.backend.Tier;

public record ModelCandidate(String backendName, ModelDescriptor descriptor) {

    public String qualifiedId() {
        return backendName + ModelRef.SEPARATOR + descriptor.id();
    }

    public Tier tier() {
        return descriptor.tier();
    }
}
