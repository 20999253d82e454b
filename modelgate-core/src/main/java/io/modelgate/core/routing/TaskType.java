package io.modelgate.core.routing;

import java.util.Locale;
import java.util.Optional;

public enum TaskType {
    VISION,
    CODER,
    CHAT;

    public static Optional<TaskType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (TaskType type : values()) {
            if (type.name().equalsIgnoreCase(raw.trim())) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
