package me.golemcore.bridge.port.outbound;

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

import me.golemcore.bridge.domain.model.ToolCallResult;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolListResult;

import java.io.Closeable;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for a single channel to a tool host (an MCP server process or an
 * in-process registry). Abstracts transport and protocol from the tool session.
 *
 * <p>
 * A port instance owns exactly one channel and is never shared between
 * sessions.
 */
public interface ToolHostPort extends Closeable {

    /**
     * Opens the channel and completes the versioned handshake.
     *
     * @throws me.golemcore.bridge.domain.exception.HostUnavailableException
     *             if the host cannot be reached
     * @throws me.golemcore.bridge.domain.exception.ToolHostConnectionException
     *             if the handshake does not complete
     */
    ToolHostInfo connect();

    /**
     * Lists every tool the host exposes. Valid only after {@link #connect()}.
     *
     * @throws me.golemcore.bridge.domain.exception.ToolHostConnectionException
     *             if the listing fails
     */
    ToolListResult listTools();

    /**
     * Invokes a tool. The future completes exceptionally with a
     * {@link me.golemcore.bridge.domain.exception.ToolCallException} for
     * host-side failures and with an {@link java.io.IOException} when the
     * channel is gone.
     */
    CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments);

    /**
     * Checks whether the channel is open and the host still alive.
     */
    boolean isRunning();

    /**
     * Releases the channel. Idempotent and never throws.
     */
    @Override
    void close();
}
