package me.golemcore.bridge.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bridge.domain.model.McpConfig;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ToolHostPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;

class McpToolHostFactoryTest {

    private BridgeProperties properties;
    private McpToolHostFactory factory;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        properties.getToolHost().setType("mcp");
        properties.getToolHost().getMcp().setCommand("npx -y @modelcontextprotocol/server-everything");
        factory = new McpToolHostFactory(properties, new ObjectMapper());
    }

    @Test
    void shouldBuildConfigFromProperties() {
        properties.getToolHost().getMcp().setName("everything");
        properties.getToolHost().getMcp().setEnv(Map.of("API_TOKEN", "t"));
        properties.getToolHost().getMcp().setStartupTimeoutSeconds(10);
        properties.getToolHost().setToolCallTimeoutSeconds(15);

        McpConfig config = factory.buildConfig();

        assertEquals("everything", config.getName());
        assertEquals("npx -y @modelcontextprotocol/server-everything", config.getCommand());
        assertEquals(Map.of("API_TOKEN", "t"), config.getEnv());
        assertEquals(10, config.getStartupTimeoutSeconds());
        assertEquals(15, config.getRequestTimeoutSeconds());
    }

    @Test
    void shouldFallBackToDefaultsForInvalidValues() {
        properties.getToolHost().getMcp().setName(" ");
        properties.getToolHost().getMcp().setEnv(null);
        properties.getToolHost().getMcp().setStartupTimeoutSeconds(0);
        properties.getToolHost().setToolCallTimeoutSeconds(-1);

        McpConfig config = factory.buildConfig();

        assertEquals("mcp", config.getName());
        assertEquals(Map.of(), config.getEnv());
        assertEquals(30, config.getStartupTimeoutSeconds());
        assertEquals(60, config.getRequestTimeoutSeconds());
    }

    @Test
    void shouldCreateFreshClientEachTime() {
        ToolHostPort first = factory.create();
        ToolHostPort second = factory.create();

        assertInstanceOf(McpClient.class, first);
        assertNotSame(first, second);
        first.close();
        second.close();
    }
}
