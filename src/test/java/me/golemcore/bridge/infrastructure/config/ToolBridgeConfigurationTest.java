package me.golemcore.bridge.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bridge.adapter.outbound.inprocess.InProcessToolHost;
import me.golemcore.bridge.adapter.outbound.mcp.McpClient;
import me.golemcore.bridge.adapter.outbound.mcp.McpToolHostFactory;
import me.golemcore.bridge.domain.component.ToolComponent;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import me.golemcore.bridge.port.outbound.ToolHostFactory;
import me.golemcore.bridge.port.outbound.ToolHostPort;
import me.golemcore.bridge.tools.EchoTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ToolBridgeConfigurationTest {

    private final ToolBridgeConfiguration configuration = new ToolBridgeConfiguration();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ToolComponent> components = List.of(new EchoTool());
    private BridgeProperties properties;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
    }

    @Test
    void shouldUseInProcessHostByDefault() {
        ToolHostFactory factory = configuration.toolHostFactory(properties, objectMapper, components);

        ToolHostPort host = factory.create();

        assertInstanceOf(InProcessToolHost.class, host);
        host.connect();
        assertEquals("echo", host.listTools().tools().get(0).getName());
        host.close();
    }

    @Test
    void shouldUseMcpHostWhenConfigured() {
        properties.getToolHost().setType("MCP");
        properties.getToolHost().getMcp().setCommand("my-mcp-server");

        ToolHostFactory factory = configuration.toolHostFactory(properties, objectMapper, components);

        assertInstanceOf(McpToolHostFactory.class, factory);
        ToolHostPort host = factory.create();
        assertInstanceOf(McpClient.class, host);
        host.close();
    }

    @Test
    void shouldRejectUnknownHostType() {
        properties.getToolHost().setType("grpc");

        assertThrows(IllegalStateException.class,
                () -> configuration.toolHostFactory(properties, objectMapper, components));
    }

    @Test
    void shouldCreateModelBackendWithoutApiKey() {
        ExecutorService executor = configuration.modelBackendExecutor();
        try {
            ModelBackendPort backend = configuration.modelBackend(properties, objectMapper, executor);

            assertEquals("gemini-2.0-flash", backend.getModel());
            assertFalse(backend.isAvailable());
        } finally {
            executor.shutdownNow();
        }
    }
}
