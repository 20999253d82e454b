package io.modelgate.core.gateway;

import io.modelgate.core.backend.Backend;
import io.modelgate.core.backend.ModelDescriptor;
import io.modelgate.core.routing.ModelCandidate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The registration table, built once at startup and read-only afterwards, so concurrent requests
 * can share it without locking. Iteration follows registration order.
 */
public final class BackendRegistry {
    private final Map<String, BackendRegistration> registrations;

    private BackendRegistry(Map<String, BackendRegistration> registrations) {
        this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BackendRegistry empty() {
        return new BackendRegistry(Map.of());
    }

    public Optional<BackendRegistration> find(String name) {
        return Optional.ofNullable(registrations.get(name));
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    public List<BackendRegistration> registrations() {
        return List.copyOf(registrations.values());
    }

    /**
     * Registrations by ascending priority; ties keep registration order.
     */
    public List<BackendRegistration> byPriority() {
        List<BackendRegistration> sorted = new ArrayList<>(registrations.values());
        sorted.sort(Comparator.comparingInt(BackendRegistration::priority));
        return sorted;
    }

    /**
     * Every concrete model the router may pick, in registration order.
     */
    public List<ModelCandidate> candidates() {
        List<ModelCandidate> candidates = new ArrayList<>();
        for (BackendRegistration registration : registrations.values()) {
            for (String modelId : registration.concreteModelIds()) {
                candidates.add(new ModelCandidate(registration.name(), registration.descriptorFor(modelId)));
            }
        }
        return candidates;
    }

    public static final class Builder {
        private final Map<String, BackendRegistration> registrations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder registerBackend(
            String name,
            Backend backend,
            List<String> modelIds,
            int priority,
            List<ModelDescriptor> descriptors
        ) {
            return register(new BackendRegistration(name, backend, modelIds, descriptors, priority));
        }

        public Builder register(BackendRegistration registration) {
            if (registrations.containsKey(registration.name())) {
                throw new IllegalArgumentException("Backend already registered: " + registration.name());
            }
            registrations.put(registration.name(), registration);
            return this;
        }

        public BackendRegistry build() {
            return new BackendRegistry(registrations);
        }
    }
}
