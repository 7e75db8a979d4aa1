package me.golemcore.bridge.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.bridge.domain.exception.HostUnavailableException;
import me.golemcore.bridge.domain.exception.ToolHostConnectionException;
import me.golemcore.bridge.domain.model.McpConfig;
import me.golemcore.bridge.domain.model.SchemaType;
import me.golemcore.bridge.domain.model.ToolCallResult;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolListResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for McpClient JSON-RPC framing, response routing and result parsing.
 * Most tests inject a writer instead of spawning a process.
 */
class McpClientTest {

    private static final String FIELD_WRITER = "writer";
    private static final String FIELD_RUNNING = "running";
    private static final String CMD_TEST = "test";
    private static final String TOOL_CREATE_ISSUE = "create_issue";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private McpClient newClient(String command) {
        McpConfig config = McpConfig.builder()
                .name("test-server")
                .command(command)
                .startupTimeoutSeconds(5)
                .requestTimeoutSeconds(5)
                .build();
        return new McpClient(config, objectMapper);
    }

    private StringWriter injectWriter(McpClient client) {
        StringWriter stringWriter = new StringWriter();
        ReflectionTestUtils.setField(client, FIELD_WRITER, new BufferedWriter(stringWriter));
        return stringWriter;
    }

    // ===== Framing =====

    @Test
    void shouldWriteRequestAsSingleJsonLine() throws Exception {
        try (McpClient client = newClient(CMD_TEST)) {
            StringWriter output = injectWriter(client);

            CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

            String line = output.toString();
            assertTrue(line.endsWith(System.lineSeparator()));
            JsonNode request = objectMapper.readTree(line);
            assertEquals("2.0", request.get("jsonrpc").asText());
            assertEquals("tools/list", request.get("method").asText());
            assertTrue(request.get("id").canConvertToInt());
            assertTrue(request.has("params"));
            future.cancel(true);
        }
    }

    @Test
    void shouldAssignIncreasingIds() throws Exception {
        try (McpClient client = newClient(CMD_TEST)) {
            StringWriter output = injectWriter(client);

            client.sendRequest("a", Map.of());
            client.sendRequest("b", Map.of());

            String[] lines = output.toString().split(System.lineSeparator());
            int first = objectMapper.readTree(lines[0]).get("id").asInt();
            int second = objectMapper.readTree(lines[1]).get("id").asInt();
            assertEquals(first + 1, second);
        }
    }

    @Test
    void shouldOmitIdAndEmptyParamsInNotification() throws Exception {
        try (McpClient client = newClient(CMD_TEST)) {
            StringWriter output = injectWriter(client);

            client.sendNotification("notifications/initialized", Map.of());

            JsonNode notification = objectMapper.readTree(output.toString());
            assertEquals("notifications/initialized", notification.get("method").asText());
            assertFalse(notification.has("id"));
            assertFalse(notification.has("params"));
        }
    }

    @Test
    void shouldKeepNonEmptyNotificationParams() throws Exception {
        try (McpClient client = newClient(CMD_TEST)) {
            StringWriter output = injectWriter(client);

            client.sendNotification("test/method", Map.of("key", "value"));

            assertEquals("value", objectMapper.readTree(output.toString()).get("params").get("key").asText());
        }
    }

    @Test
    void shouldFailRequestWhenNotStarted() {
        try (McpClient client = newClient(CMD_TEST)) {
            CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

            ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
            assertInstanceOf(IOException.class, ex.getCause());
        }
    }

    // ===== Response routing =====

    @Test
    void shouldCompletePendingRequestWithResult() throws Exception {
        try (McpClient client = newClient(CMD_TEST)) {
            injectWriter(client);
            CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

            client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"tools\":[]}}");

            JsonNode result = future.get(1, TimeUnit.SECONDS);
            assertTrue(result.get("tools").isArray());
        }
    }

    @Test
    void shouldCompletePendingRequestWithMcpException() {
        try (McpClient client = newClient(CMD_TEST)) {
            injectWriter(client);
            CompletableFuture<JsonNode> future = client.sendRequest("tools/call", Map.of());

            client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32601,\"message\":\"Method not found\"}}");

            ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
            McpClient.McpException mcp = assertInstanceOf(McpClient.McpException.class, ex.getCause());
            assertEquals(-32601, mcp.getCode());
            assertEquals("Method not found", mcp.getMessage());
        }
    }

    @Test
    void shouldIgnoreUnknownIdsNotificationsAndGarbage() {
        try (McpClient client = newClient(CMD_TEST)) {
            injectWriter(client);
            CompletableFuture<JsonNode> future = client.sendRequest("tools/list", Map.of());

            client.handleMessage("{\"jsonrpc\":\"2.0\",\"id\":99,\"result\":{}}");
            client.handleMessage("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/progress\"}");
            client.handleMessage("not json at all");

            assertFalse(future.isDone());
        }
    }

    @Test
    void shouldFailPendingRequestsOnClose() {
        McpClient client = newClient(CMD_TEST);
        injectWriter(client);
        ReflectionTestUtils.setField(client, FIELD_RUNNING, true);
        CompletableFuture<JsonNode> future = client.sendRequest("tools/call", Map.of());

        client.close();

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        assertInstanceOf(IOException.class, ex.getCause());
        assertFalse(client.isRunning());
    }

    @Test
    void shouldFailCallWithIoExceptionWhenNotRunning() {
        try (McpClient client = newClient(CMD_TEST)) {
            CompletableFuture<ToolCallResult> future = client.callTool("echo", Map.of());

            ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
            assertInstanceOf(IOException.class, ex.getCause());
        }
    }

    // ===== Parsing =====

    @Test
    void shouldParseToolSpecs() throws Exception {
        String response = """
                {
                  "tools": [
                    {
                      "name": "create_issue",
                      "description": "Create a GitHub issue",
                      "inputSchema": {
                        "type": "object",
                        "properties": {
                          "title": {"type": "string", "description": "Issue title"},
                          "labels": {"type": "array", "items": {"type": "string"}}
                        },
                        "required": ["title"]
                      }
                    },
                    {"description": "nameless"},
                    {"name": "list_repos"}
                  ]
                }
                """;

        try (McpClient client = newClient(CMD_TEST)) {
            List<ToolSpec> tools = client.parseToolSpecs(objectMapper.readTree(response));

            assertEquals(2, tools.size());
            ToolSpec issue = tools.get(0);
            assertEquals(TOOL_CREATE_ISSUE, issue.getName());
            assertEquals(List.of("title"), issue.getParameterSchema().getRequired());
            assertEquals(SchemaType.ARRAY, issue.getParameterSchema().getProperties().get("labels").resolvedType());
            ToolSpec repos = tools.get(1);
            assertEquals("", repos.getDescription());
            assertEquals(SchemaType.OBJECT, repos.getParameterSchema().resolvedType());
            assertTrue(repos.getParameterSchema().getProperties().isEmpty());
        }
    }

    @Test
    void shouldParseToolCallResultTextSegments() throws Exception {
        String response = """
                {
                  "content": [
                    {"type": "text", "text": "Line 1"},
                    {"type": "image", "data": "base64..."},
                    {"type": "text", "text": "Line 2"}
                  ]
                }
                """;

        try (McpClient client = newClient(CMD_TEST)) {
            ToolCallResult result = client.parseToolCallResult(objectMapper.readTree(response));

            assertFalse(result.isError());
            assertEquals(List.of("Line 1", "Line 2"), result.content());
        }
    }

    @Test
    void shouldParseToolCallErrorFlag() throws Exception {
        String response = """
                {"isError": true, "content": [{"type": "text", "text": "Repository not found"}]}
                """;

        try (McpClient client = newClient(CMD_TEST)) {
            ToolCallResult result = client.parseToolCallResult(objectMapper.readTree(response));

            assertTrue(result.isError());
            assertEquals(List.of("Repository not found"), result.content());
        }
    }

    @Test
    void shouldParseMissingResultAsEmptySuccess() {
        try (McpClient client = newClient(CMD_TEST)) {
            ToolCallResult result = client.parseToolCallResult(null);

            assertFalse(result.isError());
            assertTrue(result.content().isEmpty());
        }
    }

    // ===== Lifecycle =====

    @Test
    void shouldRejectMissingCommand() {
        try (McpClient client = new McpClient(McpConfig.builder().name("empty").build(), objectMapper)) {
            assertThrows(HostUnavailableException.class, client::connect);
            assertFalse(client.isRunning());
        }
    }

    @Test
    void shouldRejectListingBeforeConnect() {
        try (McpClient client = newClient(CMD_TEST)) {
            assertThrows(ToolHostConnectionException.class, client::listTools);
        }
    }

    @Test
    void shouldDefaultHostName() {
        try (McpClient client = new McpClient(McpConfig.builder().command(CMD_TEST).build(), objectMapper)) {
            assertEquals("mcp", client.getHostName());
        }
    }

    @Test
    void shouldCloseWithoutStartedProcess() {
        McpClient client = newClient(CMD_TEST);

        client.close();
        client.close();

        assertFalse(client.isRunning());
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldFailHandshakeWhenServerExitsImmediately() {
        try (McpClient client = newClient("exit 0")) {
            ToolHostConnectionException ex = assertThrows(ToolHostConnectionException.class, client::connect);

            assertFalse(ex instanceof HostUnavailableException);
            assertFalse(client.isRunning());
        }
    }

    @Test
    @EnabledOnOs({ OS.LINUX, OS.MAC })
    void shouldTalkToScriptedServer() throws Exception {
        String script = String.join("; ",
                "read -r l",
                "echo '{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{\"protocolVersion\":\"2024-11-05\","
                        + "\"serverInfo\":{\"name\":\"scripted\",\"version\":\"0.1\"}}}'",
                "read -r l",
                "read -r l",
                "echo '{\"jsonrpc\":\"2.0\",\"id\":2,\"result\":{\"tools\":[{\"name\":\"echo\"}],"
                        + "\"nextCursor\":\"p2\"}}'",
                "read -r l",
                "echo '{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{\"tools\":[{\"name\":\"add\"}]}}'",
                "read -r l",
                "echo '{\"jsonrpc\":\"2.0\",\"id\":4,\"result\":{\"content\":[{\"type\":\"text\",\"text\":\"hi\"}]}}'",
                "sleep 1");

        try (McpClient client = newClient(script)) {
            ToolHostInfo info = client.connect();
            assertEquals("scripted", info.name());
            assertEquals("0.1", info.version());
            assertEquals(McpClient.MCP_PROTOCOL_VERSION, info.protocolVersion());

            ToolListResult listed = client.listTools();
            assertEquals(List.of("echo", "add"), listed.tools().stream().map(ToolSpec::getName).toList());

            ToolCallResult result = client.callTool("echo", Map.of("text", "hi")).get(5, TimeUnit.SECONDS);
            assertEquals(List.of("hi"), result.content());
            assertFalse(result.isError());
        }
    }

    @Test
    void shouldPreserveMcpExceptionCode() {
        McpClient.McpException ex = new McpClient.McpException(-32602, "Invalid params");

        assertEquals(-32602, ex.getCode());
        assertEquals("Invalid params", ex.getMessage());
        assertNull(ex.getCause());
    }
}
