package io.modelgate.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".modelgate", "config.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return defaultConfigPath();
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
