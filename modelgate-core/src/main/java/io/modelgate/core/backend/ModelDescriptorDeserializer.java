package io.modelgate.core.backend;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * Accepts either {@code "model-id"} or a full object. Object fields use the record names
 * ({@code reasoning}, {@code toolUse}, {@code tier}) or the short config names
 * ({@code think}, {@code tool}, {@code level}).
 */
public final class ModelDescriptorDeserializer extends StdDeserializer<ModelDescriptor> {

    public ModelDescriptorDeserializer() {
        super(ModelDescriptor.class);
    }

    @Override
    public ModelDescriptor deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node.isTextual()) {
            return ModelDescriptor.defaults(node.asText());
        }
        if (!node.isObject() || !node.hasNonNull("id")) {
            return (ModelDescriptor) context.handleUnexpectedToken(ModelDescriptor.class, parser);
        }

        String id = node.path("id").asText();
        boolean vision = node.path("vision").asBoolean(false);
        boolean reasoning = first(node, "reasoning", "think").asBoolean(false);
        boolean toolUse = first(node, "toolUse", "tool").asBoolean(true);
        JsonNode tierNode = first(node, "tier", "level");
        Tier tier = tierNode.isTextual() ? Tier.fromValue(tierNode.asText()) : Tier.MEDIUM;

        GenerationConfig generation;
        if (node.has("generation")) {
            generation = parser.getCodec().treeToValue(node.get("generation"), GenerationConfig.class);
        } else {
            generation = parser.getCodec().treeToValue(node, GenerationConfig.class);
        }
        return new ModelDescriptor(id, vision, reasoning, toolUse, tier, generation);
    }

    private static JsonNode first(JsonNode node, String primary, String alias) {
        JsonNode value = node.path(primary);
        return value.isMissingNode() || value.isNull() ? node.path(alias) : value;
    }
}
