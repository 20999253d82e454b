package io.modelgate.cli;

import io.modelgate.core.config.ConfigPaths;
import io.modelgate.core.config.ConfigService;
import io.modelgate.core.config.model.ModelgateConfig;
import io.modelgate.core.runtime.ModelgateRuntime;
import java.io.IOException;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, ModelgateRuntime::fromConfig);
    }

    public Path resolveConfigPath(ModelgateCliCommand root) {
        if (root == null || root.configOverride() == null || root.configOverride().isBlank()) {
            return configPath;
        }
        return ConfigPaths.resolve(root.configOverride());
    }

    public ModelgateConfig loadConfig(ModelgateCliCommand root) throws IOException {
        return configService.load(resolveConfigPath(root));
    }

    public ModelgateRuntime buildRuntime(ModelgateConfig config) {
        return runtimeFactory.create(config);
    }
}
