package io.modelgate.core.gateway;

public record ModelValidationError(String model, String role, String message) {
}
