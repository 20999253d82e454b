package io.modelgate.core.routing;

public record ModelRef(String backendName, String modelId) {
    public static final String SEPARATOR = "/";

    /**
     * Splits on the first separator. Model ids that themselves contain slashes
     * ({@code openrouter/anthropic/claude}) keep everything after the first one.
     */
    public static ModelRef split(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ModelRef(null, null);
        }
        int index = raw.indexOf(SEPARATOR);
        if (index > 0) {
            String model = raw.substring(index + 1);
            return new ModelRef(raw.substring(0, index), model.isEmpty() ? null : model);
        }
        return new ModelRef(null, raw);
    }

    public boolean qualified() {
        return backendName != null;
    }

    public String asString() {
        if (backendName == null) {
            return modelId;
        }
        return modelId == null ? backendName : backendName + SEPARATOR + modelId;
    }
}
