package io.modelgate.cli;

import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.runtime.ModelgateRuntime;

@FunctionalInterface
public interface RuntimeFactory {
    ModelgateRuntime create(ModelgateConfig config);
}
