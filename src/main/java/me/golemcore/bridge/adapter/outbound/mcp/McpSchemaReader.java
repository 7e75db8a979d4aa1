package me.golemcore.bridge.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.SchemaType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON Schema of an MCP tool's {@code inputSchema} into
 * {@link SchemaNode}s.
 *
 * <p>
 * Only the keywords the translator understands are kept: {@code type},
 * {@code description}, {@code properties}, {@code items}, {@code required} and
 * {@code enum}. A union type such as {@code ["string", "null"]} keeps its first
 * non-null member; a tuple-style {@code items} array keeps its first element.
 */
class McpSchemaReader {

    /**
     * Reads a tool's parameter schema. A missing schema means the tool takes no
     * arguments.
     */
    SchemaNode readParameters(JsonNode inputSchema) {
        if (inputSchema == null || inputSchema.isNull() || !inputSchema.isObject()) {
            return SchemaNode.emptyObject();
        }
        SchemaNode node = read(inputSchema);
        if (node.getType() == null) {
            // Top level is always an object, even when the server omits the keyword
            return node.toBuilder().type(SchemaType.OBJECT.getJsonName()).build();
        }
        return node;
    }

    SchemaNode read(JsonNode schema) {
        SchemaNode.SchemaNodeBuilder builder = SchemaNode.builder()
                .type(readType(schema.get("type")))
                .description(textOrNull(schema.get("description")));

        JsonNode properties = schema.get("properties");
        if (properties != null && properties.isObject()) {
            Map<String, SchemaNode> children = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                // Keep malformed entries as null so translation reports and drops them
                children.put(field.getKey(), field.getValue().isObject() ? read(field.getValue()) : null);
            }
            builder.properties(children);
        }

        JsonNode items = schema.get("items");
        if (items != null && items.isArray() && items.size() > 0) {
            items = items.get(0);
        }
        if (items != null && items.isObject()) {
            builder.items(read(items));
        }

        builder.required(readStrings(schema.get("required")));
        builder.enumValues(readStrings(schema.get("enum")));
        return builder.build();
    }

    private String readType(JsonNode type) {
        if (type == null || type.isNull()) {
            return null;
        }
        if (type.isArray()) {
            for (JsonNode member : type) {
                if (member.isTextual() && !"null".equals(member.asText())) {
                    return member.asText();
                }
            }
            return null;
        }
        return type.isTextual() ? type.asText() : null;
    }

    private List<String> readStrings(JsonNode array) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode value : array) {
            if (!value.isNull()) {
                values.add(value.asText());
            }
        }
        return values;
    }

    private String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
}
