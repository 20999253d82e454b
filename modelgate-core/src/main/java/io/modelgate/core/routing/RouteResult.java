package io.modelgate.core.routing;

import io.modelgate.core.backend.ModelDescriptor;

public record RouteResult(
    String backendName,
    String modelId,
    ModelDescriptor descriptor,
    int complexityScore,
    String reason
) {

    public String qualifiedModel() {
        return new ModelRef(backendName, modelId).asString();
    }
}
