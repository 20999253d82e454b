package io.modelgate.core.gateway;

import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.ModelDescriptor;
import java.util.List;
import java.util.Objects;

/**
 * One row of the registration table. {@code modelIds} may contain {@link #WILDCARD}, meaning the
 * backend accepts any model id. Lower {@code priority} is tried first during cross-backend failover.
 */
public record BackendRegistration(
    String name,
    Backend backend,
    List<String> modelIds,
    List<ModelDescriptor> descriptors,
    int priority
) {
    public static final String WILDCARD = "*";

    public BackendRegistration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(backend, "backend must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("backend name must not be blank");
        }
        modelIds = modelIds == null ? List.of() : List.copyOf(modelIds);
        descriptors = descriptors == null ? List.of() : List.copyOf(descriptors);
    }

    public boolean serves(String modelId) {
        return modelIds.contains(modelId) || modelIds.contains(WILDCARD);
    }

    public ModelDescriptor descriptorFor(String modelId) {
        for (ModelDescriptor descriptor : descriptors) {
            if (descriptor.id().equals(modelId)) {
                return descriptor;
            }
        }
        return ModelDescriptor.defaults(modelId);
    }

    public List<String> concreteModelIds() {
        return modelIds.stream().filter(id -> !WILDCARD.equals(id)).toList();
    }
}
