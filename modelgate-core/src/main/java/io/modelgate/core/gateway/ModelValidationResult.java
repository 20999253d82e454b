package io.modelgate.core.gateway;

import java.util.List;

public record ModelValidationResult(List<ModelValidationError> errors) {

    public ModelValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
