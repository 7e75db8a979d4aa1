package me.golemcore.bridge.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.domain.exception.NotConnectedException;
import me.golemcore.bridge.domain.exception.SessionBrokenException;
import me.golemcore.bridge.domain.exception.ToolCallException;
import me.golemcore.bridge.domain.exception.ToolHostConnectionException;
import me.golemcore.bridge.domain.model.ToolCallResult;
import me.golemcore.bridge.domain.model.ToolFailureKind;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolListResult;
import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import me.golemcore.bridge.domain.model.TranslatedToolSet;
import me.golemcore.bridge.port.outbound.ToolHostFactory;
import me.golemcore.bridge.port.outbound.ToolHostPort;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the connection to a tool host for its whole lifecycle.
 *
 * <p>
 * {@link #connect()} opens the channel, completes the handshake, lists the
 * tools exactly once and caches their translated declarations. The cache lives
 * until {@link #close()} or until the channel breaks; only a later connect
 * rebuilds it.
 *
 * <p>
 * {@link #callTool(String, Map)} never raises for host-side failures. Those
 * come back as failed {@link ToolResult}s. Only a dead channel raises
 * {@link SessionBrokenException}.
 *
 * <p>
 * Thread-safe: lifecycle methods are synchronized, and calls may run
 * concurrently as long as the underlying host multiplexes them.
 */
@Slf4j
public class ToolSession implements AutoCloseable {

    private final ToolHostFactory hostFactory;
    private final SchemaTranslator schemaTranslator;
    private final Duration toolCallTimeout;

    private volatile ToolHostPort host;
    private volatile ToolHostInfo hostInfo;
    private volatile List<ToolSpec> tools = List.of();
    private volatile TranslatedToolSet translatedTools = TranslatedToolSet.empty();
    private volatile boolean connected;

    public ToolSession(ToolHostFactory hostFactory, SchemaTranslator schemaTranslator, Duration toolCallTimeout) {
        this.hostFactory = hostFactory;
        this.schemaTranslator = schemaTranslator;
        this.toolCallTimeout = toolCallTimeout;
    }

    /**
     * Connects to the tool host. A no-op when already connected.
     *
     * @throws me.golemcore.bridge.domain.exception.HostUnavailableException
     *             if the host cannot be reached
     * @throws ToolHostConnectionException
     *             if the handshake or tool listing does not complete
     */
    public synchronized void connect() {
        if (connected) {
            log.debug("[ToolSession] Already connected to {}", describeHost());
            return;
        }

        // Leftovers from a broken or closed channel
        releaseHost();

        ToolHostPort newHost = null;
        try {
            newHost = hostFactory.create();
            ToolHostInfo info = newHost.connect();
            ToolListResult listed = newHost.listTools();
            List<ToolSpec> specs = listed != null ? listed.tools() : List.of();
            TranslatedToolSet translated = schemaTranslator.translateAll(specs);

            this.host = newHost;
            this.hostInfo = info;
            this.tools = List.copyOf(specs);
            this.translatedTools = translated;
            this.connected = true;

            log.info("[ToolSession] Connected to {}: {} tools, {} translated, {} diagnostics",
                    describeHost(), specs.size(), translated.size(), translated.diagnostics().size());
        } catch (ToolHostConnectionException e) {
            closeQuietly(newHost);
            log.error("[ToolSession] Connection failed: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            closeQuietly(newHost);
            log.error("[ToolSession] Connection failed", e);
            throw new ToolHostConnectionException("Tool host connection failed: " + e.getMessage(), e);
        }
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Tools reported by the host at connect time.
     *
     * @throws NotConnectedException
     *             before connect or after close
     */
    public List<ToolSpec> listCachedTools() {
        requireConnected();
        return tools;
    }

    /**
     * Model-native declarations of the cached tools.
     *
     * @throws NotConnectedException
     *             before connect or after close
     */
    public TranslatedToolSet getTranslatedTools() {
        requireConnected();
        return translatedTools;
    }

    public ToolHostInfo getHostInfo() {
        return hostInfo;
    }

    /**
     * Invokes a tool and waits for its outcome, at most the configured tool-call
     * timeout.
     *
     * @throws NotConnectedException
     *             if the session is not connected
     * @throws SessionBrokenException
     *             if the channel to the host is gone
     */
    public ToolResult callTool(String name, Map<String, Object> arguments) {
        ToolHostPort currentHost = requireConnected();
        Map<String, Object> args = arguments != null ? arguments : Map.of();

        log.debug("[ToolSession] Calling tool '{}' with {} argument(s)", name, args.size());

        CompletableFuture<ToolCallResult> future;
        try {
            future = currentHost.callTool(name, args);
        } catch (RuntimeException e) {
            log.warn("[ToolSession] Tool '{}' failed to dispatch: {}", name, e.getMessage());
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, messageOf(e));
        }

        try {
            ToolCallResult result = future.get(toolCallTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ToolResult.success(List.of());
            }
            if (result.isError()) {
                String error = result.content().isEmpty()
                        ? "Tool '" + name + "' reported an error"
                        : String.join("\n", result.content());
                log.debug("[ToolSession] Tool '{}' returned error: {}", name, error);
                return ToolResult.failure(error);
            }
            return ToolResult.success(result.content());
        } catch (TimeoutException e) {
            future.cancel(true);
            String error = "Tool '" + name + "' timed out after " + toolCallTimeout.toSeconds() + "s";
            log.warn("[ToolSession] {}", error);
            return ToolResult.failure(ToolFailureKind.TIMEOUT, error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool call interrupted");
        } catch (CancellationException e) {
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool call cancelled");
        } catch (ExecutionException e) {
            return handleCallFailure(name, currentHost, e.getCause() != null ? e.getCause() : e);
        }
    }

    /**
     * Releases the channel and drops the cache. Idempotent; never throws.
     */
    @Override
    public synchronized void close() {
        if (host == null && !connected) {
            return;
        }
        log.info("[ToolSession] Closing session to {}", describeHost());
        releaseHost();
        clearCache();
    }

    private ToolResult handleCallFailure(String name, ToolHostPort failedHost, Throwable cause) {
        if (cause instanceof ToolCallException) {
            log.debug("[ToolSession] Tool '{}' failed: {}", name, cause.getMessage());
            return ToolResult.failure(messageOf(cause));
        }
        if (cause instanceof IOException) {
            markBroken(failedHost, cause);
            throw new SessionBrokenException("Tool host channel is gone: " + cause.getMessage(), cause);
        }
        if (cause instanceof TimeoutException) {
            // Host-side request timeout, shorter than ours
            log.warn("[ToolSession] Tool '{}' timed out on the host side", name);
            return ToolResult.failure(ToolFailureKind.TIMEOUT, "Tool '" + name + "' timed out");
        }
        log.warn("[ToolSession] Tool '{}' execution failed: {}", name, cause.getMessage());
        return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, messageOf(cause));
    }

    private synchronized void markBroken(ToolHostPort failedHost, Throwable cause) {
        // A concurrent reconnect may already have replaced the host
        if (host != failedHost) {
            return;
        }
        log.error("[ToolSession] Session to {} broken: {}", describeHost(), cause.getMessage());
        releaseHost();
        clearCache();
    }

    private ToolHostPort requireConnected() {
        ToolHostPort currentHost = host;
        if (!connected || currentHost == null) {
            throw new NotConnectedException("Tool session is not connected");
        }
        return currentHost;
    }

    private void releaseHost() {
        ToolHostPort previous = host;
        host = null;
        connected = false;
        closeQuietly(previous);
    }

    private void closeQuietly(ToolHostPort target) {
        if (target == null) {
            return;
        }
        try {
            target.close();
        } catch (RuntimeException e) {
            log.warn("[ToolSession] Error closing tool host: {}", e.getMessage());
        }
    }

    private void clearCache() {
        tools = List.of();
        translatedTools = TranslatedToolSet.empty();
        hostInfo = null;
    }

    private String describeHost() {
        ToolHostInfo info = hostInfo;
        return info != null ? info.name() + " " + info.version() : "tool host";
    }

    private static String messageOf(Throwable throwable) {
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }
}
