package me.golemcore.bridge.tools;

import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoToolTest {

    private final EchoTool tool = new EchoTool();

    @Test
    void shouldDeclareRequiredTextParameter() {
        ToolSpec spec = tool.getSpec();

        assertEquals("echo", spec.getName());
        assertEquals("echo", tool.getToolName());
        assertEquals("tool", tool.getComponentType());
        assertTrue(spec.getParameterSchema().getProperties().containsKey("text"));
        assertEquals(List.of("text"), spec.getParameterSchema().getRequired());
    }

    @Test
    void shouldEchoText() {
        ToolResult result = tool.execute(Map.of("text", "Hello, tools")).join();

        assertTrue(result.isSuccess());
        assertEquals("Hello, tools", result.getOutput());
    }

    @Test
    void shouldStringifyNonTextValues() {
        ToolResult result = tool.execute(Map.of("text", 42)).join();

        assertEquals("42", result.getOutput());
    }

    @Test
    void shouldFailWithoutText() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameter: text", result.getError());
    }
}
