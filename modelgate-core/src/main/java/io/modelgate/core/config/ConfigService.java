package io.modelgate.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelgate.core.config.model.ModelgateConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Loads {@code config.json} on top of the built-in defaults. Objects merge key by key; arrays and
 * the {@code providers} table replace the defaults wholesale, so a config that lists its own
 * providers never inherits the sample local one.
 *
 * <p>User keys are canonicalized before merging ({@code base_score} becomes {@code baseScore},
 * {@code check} becomes {@code intent}) so they override the default entry instead of sitting
 * next to it.
 */
public final class ConfigService {
    private static final Set<String> REPLACED_KEYS = Set.of("providers");
    // maps keyed by user-chosen names
    private static final Set<String> VERBATIM_CHILDREN = Set.of("providers", "extraHeaders");
    private static final Map<String, String> RENAMED_KEYS = Map.of("check", "intent");

    private final ObjectMapper mapper;

    public ConfigService() {
        mapper = new ObjectMapper();
    }

    public ModelgateConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ModelgateConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ModelgateConfig.defaults());
        JsonNode existingNode = canonicalize(mapper.readTree(Files.readString(configPath)), false);
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, ModelgateConfig.class);
    }

    public void save(Path configPath, ModelgateConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        ModelgateConfig config;
        if (created || overwrite) {
            config = ModelgateConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = load(configPath);
        }

        save(configPath, config);
        return new InitResult(configPath, created, overwritten);
    }

    public String toPrettyJson(ModelgateConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private JsonNode canonicalize(JsonNode node, boolean verbatimKeys) {
        if (node == null) {
            return null;
        }
        if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                ((ArrayNode) node).set(i, canonicalize(node.get(i), false));
            }
            return node;
        }
        if (!node.isObject()) {
            return node;
        }

        ObjectNode canonical = mapper.createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            String key = verbatimKeys ? entry.getKey() : canonicalKey(entry.getKey());
            canonical.set(key, canonicalize(entry.getValue(), !verbatimKeys && VERBATIM_CHILDREN.contains(key)));
        }
        return canonical;
    }

    private static String canonicalKey(String key) {
        String renamed = RENAMED_KEYS.getOrDefault(key, key);
        if (renamed.indexOf('_') < 0) {
            return renamed;
        }
        StringBuilder camel = new StringBuilder(renamed.length());
        boolean upper = false;
        for (char c : renamed.toCharArray()) {
            if (c == '_') {
                upper = camel.length() > 0;
                continue;
            }
            camel.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        return camel.toString();
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            JsonNode value = REPLACED_KEYS.contains(entry.getKey())
                ? entry.getValue()
                : deepMerge(existing, entry.getValue());
            merged.set(entry.getKey(), value);
        });
        return merged;
    }
}
