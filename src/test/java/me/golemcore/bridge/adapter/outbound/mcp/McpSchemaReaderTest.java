package me.golemcore.bridge.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.SchemaType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpSchemaReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final McpSchemaReader reader = new McpSchemaReader();

    @Test
    void shouldReadMissingSchemaAsEmptyObject() {
        SchemaNode node = reader.readParameters(null);

        assertEquals(SchemaType.OBJECT, node.resolvedType());
        assertTrue(node.getProperties().isEmpty());
    }

    @Test
    void shouldAssumeObjectAtTopLevel() throws Exception {
        SchemaNode node = reader.readParameters(objectMapper.readTree("""
                {"properties": {"q": {"type": "string"}}}
                """));

        assertEquals(SchemaType.OBJECT, node.resolvedType());
        assertEquals(SchemaType.STRING, node.getProperties().get("q").resolvedType());
    }

    @Test
    void shouldReadNestedSchema() throws Exception {
        SchemaNode node = reader.readParameters(objectMapper.readTree("""
                {
                  "type": "object",
                  "properties": {
                    "order": {"type": "string", "enum": ["asc", "desc"], "description": "Sort order"},
                    "matrix": {"type": "array", "items": {"type": "array", "items": {"type": "number"}}},
                    "filter": {
                      "type": "object",
                      "properties": {"field": {"type": "string"}},
                      "required": ["field"]
                    }
                  },
                  "required": ["order"]
                }
                """));

        assertEquals(List.of("order"), node.getRequired());
        SchemaNode order = node.getProperties().get("order");
        assertEquals(List.of("asc", "desc"), order.getEnumValues());
        assertEquals("Sort order", order.getDescription());
        SchemaNode matrix = node.getProperties().get("matrix");
        assertEquals(SchemaType.NUMBER, matrix.getItems().getItems().resolvedType());
        SchemaNode filter = node.getProperties().get("filter");
        assertEquals(List.of("field"), filter.getRequired());
    }

    @Test
    void shouldPickFirstNonNullUnionMember() throws Exception {
        SchemaNode node = reader.read(objectMapper.readTree("""
                {"type": ["null", "integer"]}
                """));

        assertEquals(SchemaType.INTEGER, node.resolvedType());
    }

    @Test
    void shouldKeepFirstTupleItem() throws Exception {
        SchemaNode node = reader.read(objectMapper.readTree("""
                {"type": "array", "items": [{"type": "boolean"}, {"type": "string"}]}
                """));

        assertEquals(SchemaType.BOOLEAN, node.getItems().resolvedType());
    }

    @Test
    void shouldKeepMalformedPropertyAsNull() throws Exception {
        SchemaNode node = reader.read(objectMapper.readTree("""
                {"type": "object", "properties": {"ok": {"type": "string"}, "bad": true}}
                """));

        assertEquals(2, node.getProperties().size());
        assertNull(node.getProperties().get("bad"));
    }

    @Test
    void shouldLeaveUnknownTypeAsIs() throws Exception {
        SchemaNode node = reader.read(objectMapper.readTree("""
                {"type": "date-time"}
                """));

        assertEquals("date-time", node.getType());
        assertNull(node.resolvedType());
    }
}
