package io.modelgate.core.gateway;

public record FailoverAttempt(String backendName, String modelId, String message) {

    @Override
    public String toString() {
        return backendName + "/" + modelId + ": " + message;
    }
}
