/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bridge.adapter.outbound.mcp;

import me.golemcore.bridge.domain.exception.HostUnavailableException;
import me.golemcore.bridge.domain.exception.ToolCallException;
import me.golemcore.bridge.domain.exception.ToolHostConnectionException;
import me.golemcore.bridge.domain.model.McpConfig;
import me.golemcore.bridge.domain.model.ToolCallResult;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolListResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import me.golemcore.bridge.port.outbound.ToolHostPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for a single MCP (Model Context Protocol) server over
 * stdio.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>{@link #connect()} spawns the server through {@code /bin/sh -c}, sends
 * {@code initialize} and then the {@code notifications/initialized}
 * notification
 * <li>{@link #listTools()} fetches {@code tools/list}, following
 * {@code nextCursor} until the listing is complete
 * <li>{@link #callTool(String, Map)} sends {@code tools/call}
 * <li>{@link #close()} fails pending requests and stops the process
 * </ol>
 *
 * <p>
 * Requests are multiplexed by JSON-RPC id: writes are serialized on the writer
 * and a reader thread completes the matching future, so concurrent calls are
 * safe. Stderr is drained to the DEBUG log.
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean; created per session by {@link McpToolHostFactory}.
 */
public class McpClient implements ToolHostPort {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final String CLIENT_NAME = "golemcore-tool-bridge";
    private static final String CLIENT_VERSION = "1.0.0";
    private static final int MAX_TOOL_PAGES = 100;

    private final McpConfig config;
    private final ObjectMapper objectMapper;
    private final McpSchemaReader schemaReader;
    private final String hostName;

    private Process process;
    private BufferedWriter writer;
    private Thread readerThread;
    private Thread stderrThread;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;
    private volatile boolean initialized;

    public McpClient(McpConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.schemaReader = new McpSchemaReader();
        this.hostName = config != null && config.getName() != null ? config.getName() : "mcp";
    }

    @Override
    public synchronized ToolHostInfo connect() {
        if (initialized && isRunning()) {
            throw new IllegalStateException("MCP client '" + hostName + "' is already connected");
        }
        if (config == null || config.getCommand() == null || config.getCommand().isBlank()) {
            throw new HostUnavailableException("No command configured for MCP server '" + hostName + "'", null);
        }

        startProcess();

        try {
            JsonNode initResult = await(sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", CLIENT_NAME,
                            "version", CLIENT_VERSION))),
                    "initialize");

            ToolHostInfo info = parseServerInfo(initResult);
            log.info("[MCP:{}] Initialized: {} {} (protocol {})", hostName, info.name(), info.version(),
                    info.protocolVersion());

            sendNotification("notifications/initialized", Map.of());
            initialized = true;
            return info;
        } catch (RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", hostName, e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public ToolListResult listTools() {
        if (!initialized) {
            throw new ToolHostConnectionException("MCP client '" + hostName + "' is not initialized");
        }

        List<ToolSpec> tools = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        for (int page = 0; page < MAX_TOOL_PAGES; page++) {
            Map<String, Object> params = cursor != null ? Map.of("cursor", cursor) : Map.of();
            JsonNode result = await(sendRequest("tools/list", params), "tools/list");
            tools.addAll(parseToolSpecs(result));

            JsonNode next = result != null ? result.get("nextCursor") : null;
            if (next == null || next.isNull() || next.asText().isEmpty()) {
                break;
            }
            cursor = next.asText();
            if (!seenCursors.add(cursor)) {
                log.warn("[MCP:{}] Server repeated cursor '{}', stopping pagination", hostName, cursor);
                break;
            }
        }

        log.info("[MCP:{}] Available tools: {}", hostName, tools.stream().map(ToolSpec::getName).toList());
        return new ToolListResult(tools);
    }

    @Override
    public CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments) {
        if (!isRunning()) {
            return CompletableFuture.failedFuture(new IOException("MCP server '" + hostName + "' is not running"));
        }
        return sendRequest("tools/call", Map.of(
                "name", name,
                "arguments", arguments != null ? arguments : Map.of()))
                .thenApply(this::parseToolCallResult);
    }

    /**
     * Send a JSON-RPC request and return a future for the result.
     */
    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(config.getRequestTimeoutSeconds(), TimeUnit.SECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            String json = objectMapper.writeValueAsString(request);
            log.debug("[MCP:{}] → {}", hostName, json);
            writeLine(json);
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }

        return future;
    }

    /**
     * Send a JSON-RPC notification (no id, no response expected).
     */
    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            String json = objectMapper.writeValueAsString(notification);
            log.debug("[MCP:{}] → (notification) {}", hostName, json);
            writeLine(json);
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification: {}", hostName, e.getMessage());
        }
    }

    /**
     * Routes one line read from the server: responses complete their pending
     * request, anything else is logged.
     */
    void handleMessage(String line) {
        try {
            JsonNode message = objectMapper.readTree(line);

            JsonNode idNode = message.get("id");
            if (idNode != null && idNode.canConvertToInt()) {
                int id = idNode.asInt();
                CompletableFuture<JsonNode> pending = pendingRequests.remove(id);
                if (pending == null) {
                    log.warn("[MCP:{}] Received response for unknown id: {}", hostName, id);
                    return;
                }
                JsonNode error = message.get("error");
                if (error != null && !error.isNull()) {
                    pending.completeExceptionally(new McpException(
                            error.has("code") ? error.get("code").asInt() : -1,
                            error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
                } else {
                    pending.complete(message.get("result"));
                }
            } else {
                String method = message.has("method") ? message.get("method").asText() : "unknown";
                log.debug("[MCP:{}] Server notification: {}", hostName, method);
            }
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Failed to parse response: {}", hostName, e.getMessage());
        }
    }

    @Override
    public boolean isRunning() {
        return running && process != null && process.isAlive();
    }

    public String getHostName() {
        return hostName;
    }

    @Override
    public void close() {
        if (!running && process == null && pendingRequests.isEmpty()) {
            return;
        }
        log.info("[MCP:{}] Closing client", hostName);
        running = false;
        initialized = false;

        failPending("MCP client closing");

        // Close writer to release process stdin
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[MCP:{}] Error closing writer: {}", hostName, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
        process = null;
    }

    private void startProcess() {
        log.info("[MCP:{}] Starting server: {}", hostName, config.getCommand());

        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", config.getCommand());
        pb.redirectErrorStream(false);
        if (config.getEnv() != null) {
            pb.environment().putAll(config.getEnv());
        }

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new HostUnavailableException("Cannot start MCP server '" + hostName + "': " + e.getMessage(), e);
        }
        running = true;

        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));

        readerThread = new Thread(this::readLoop, "mcp-reader-" + hostName);
        readerThread.setDaemon(true);
        readerThread.start();

        stderrThread = new Thread(this::stderrDrain, "mcp-stderr-" + hostName);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    private JsonNode await(CompletableFuture<JsonNode> future, String method) {
        try {
            return future.get(config.getStartupTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ToolHostConnectionException("Interrupted while waiting for " + method, e);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ToolHostConnectionException("MCP server '" + hostName + "' did not answer " + method
                    + " within " + config.getStartupTimeoutSeconds() + "s", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolHostConnectionException("MCP " + method + " failed: " + cause.getMessage(), cause);
        }
    }

    private void writeLine(String json) throws IOException {
        BufferedWriter out = writer;
        if (out == null) {
            throw new IOException("MCP server '" + hostName + "' is not started");
        }
        synchronized (out) {
            out.write(json);
            out.newLine();
            out.flush();
        }
    }

    private void readLoop() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                log.debug("[MCP:{}] ← {}", hostName, line);
                handleMessage(line);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", hostName, e.getMessage());
            }
        } finally {
            if (running) {
                log.warn("[MCP:{}] Server closed its output", hostName);
            }
            running = false;
            failPending("MCP process closed");
        }
    }

    private void stderrDrain() {
        Process p = this.process;
        if (p == null) {
            return;
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(p.getErrorStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", hostName, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[MCP:{}] Stderr drain ended: {}", hostName, e.getMessage());
            }
        }
    }

    private void failPending(String reason) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException(reason));
        }
        pendingRequests.clear();
    }

    private ToolHostInfo parseServerInfo(JsonNode initResult) {
        if (initResult == null || initResult.isNull()) {
            throw new ToolHostConnectionException("MCP server '" + hostName + "' returned an empty initialize result");
        }
        JsonNode serverInfo = initResult.path("serverInfo");
        return new ToolHostInfo(
                serverInfo.path("name").asText(hostName),
                serverInfo.path("version").asText("unknown"),
                initResult.path("protocolVersion").asText(MCP_PROTOCOL_VERSION));
    }

    List<ToolSpec> parseToolSpecs(JsonNode result) {
        if (result == null) {
            return List.of();
        }

        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolSpec> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            String name = toolNode.has("name") ? toolNode.get("name").asText() : null;
            if (name == null) {
                log.warn("[MCP:{}] Skipping tool without name", hostName);
                continue;
            }
            String description = toolNode.has("description") ? toolNode.get("description").asText() : "";

            tools.add(ToolSpec.builder()
                    .name(name)
                    .description(description)
                    .parameterSchema(schemaReader.readParameters(toolNode.get("inputSchema")))
                    .build());
        }
        return tools;
    }

    ToolCallResult parseToolCallResult(JsonNode result) {
        if (result == null || result.isNull()) {
            return new ToolCallResult(List.of(), false);
        }

        boolean isError = result.path("isError").asBoolean(false);

        List<String> segments = new ArrayList<>();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    segments.add(item.get("text").asText());
                }
            }
        }
        return new ToolCallResult(segments, isError);
    }

    /**
     * JSON-RPC error returned by the MCP server.
     */
    public static class McpException extends ToolCallException {
        private static final long serialVersionUID = 1L;
        private final int code;

        public McpException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
