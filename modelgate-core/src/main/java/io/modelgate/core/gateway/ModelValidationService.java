package io.modelgate.core.gateway;

import io.modelgate.core.routing.ModelRef;
import io.modelgate.core.routing.RouterSettings;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks that the designated chat/intent/vision/coder models point at something real.
 */
public final class ModelValidationService {
    private final BackendRegistry registry;

    public ModelValidationService(BackendRegistry registry) {
        this.registry = registry;
    }

    public ModelValidationResult validate(RouterSettings settings) {
        List<ModelValidationError> errors = new ArrayList<>();
        if (settings.chatModel() == null) {
            errors.add(new ModelValidationError("", "chat", "chat model must be configured"));
            return new ModelValidationResult(errors);
        }

        Map<String, String> designated = new LinkedHashMap<>();
        designated.put("chat", settings.chatModel());
        designated.put("intent", settings.intentModel());
        if (settings.visionModel() != null) {
            designated.put("vision", settings.visionModel());
        }
        if (settings.coderModel() != null) {
            designated.put("coder", settings.coderModel());
        }

        Map<String, Optional<List<String>>> listings = new HashMap<>();
        for (Map.Entry<String, String> entry : designated.entrySet()) {
            String model = entry.getValue();
            ModelRef ref = ModelRef.split(model);
            if (!ref.qualified()) {
                continue;
            }
            Optional<BackendRegistration> registration = registry.find(ref.backendName());
            if (registration.isEmpty()) {
                errors.add(new ModelValidationError(model, entry.getKey(), "backend " + ref.backendName() + " is not registered"));
                continue;
            }
            Optional<List<String>> live = listings.computeIfAbsent(
                ref.backendName(),
                ignored -> registration.get().backend().listModels()
            );
            if (live.isPresent() && !isAvailable(ref, live.get())) {
                errors.add(new ModelValidationError(model, entry.getKey(), entry.getKey() + " model " + model + " is not available"));
            }
        }
        return new ModelValidationResult(errors);
    }

    private boolean isAvailable(ModelRef ref, List<String> live) {
        String plain = ref.modelId() == null ? "" : ref.modelId();
        return live.stream().anyMatch(id -> id.equals(ref.asString()) || id.equals(plain) || id.endsWith("/" + plain));
    }
}
