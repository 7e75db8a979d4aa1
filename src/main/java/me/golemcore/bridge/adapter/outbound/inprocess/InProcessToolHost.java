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

package me.golemcore.bridge.adapter.outbound.inprocess;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.domain.component.ToolComponent;
import me.golemcore.bridge.domain.exception.ToolCallException;
import me.golemcore.bridge.domain.model.ToolCallResult;
import me.golemcore.bridge.domain.model.ToolHostInfo;
import me.golemcore.bridge.domain.model.ToolListResult;
import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import me.golemcore.bridge.port.outbound.ToolHostPort;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Tool host that dispatches to {@link ToolComponent}s living in the same JVM.
 *
 * <p>
 * Enabled components are indexed by name at connect time; the first component
 * wins when two share a name. Unknown tools and failing components complete the
 * call with a {@link ToolCallException}, calls after {@link #close()} with an
 * {@link IOException}.
 */
@Slf4j
public class InProcessToolHost implements ToolHostPort {

    static final String HOST_NAME = "in-process";
    static final String HOST_VERSION = "1.0.0";
    static final String PROTOCOL = "in-process/1";

    private final List<ToolComponent> components;
    private final Map<String, ToolComponent> registry = new LinkedHashMap<>();

    private volatile boolean running;

    public InProcessToolHost(List<ToolComponent> components) {
        this.components = components != null ? List.copyOf(components) : List.of();
    }

    @Override
    public synchronized ToolHostInfo connect() {
        registry.clear();
        for (ToolComponent component : components) {
            if (!component.isEnabled()) {
                continue;
            }
            String name = component.getToolName();
            if (registry.putIfAbsent(name, component) != null) {
                log.warn("[InProcess] Duplicate tool name '{}', keeping the first registration", name);
            }
        }
        running = true;
        log.info("[InProcess] Registered tools: {}", registry.keySet());
        return new ToolHostInfo(HOST_NAME, HOST_VERSION, PROTOCOL);
    }

    @Override
    public synchronized ToolListResult listTools() {
        return new ToolListResult(registry.values().stream()
                .map(ToolComponent::getSpec)
                .toList());
    }

    @Override
    public CompletableFuture<ToolCallResult> callTool(String name, Map<String, Object> arguments) {
        if (!running) {
            return CompletableFuture.failedFuture(new IOException("In-process tool host is closed"));
        }
        ToolComponent component;
        synchronized (this) {
            component = registry.get(name);
        }
        if (component == null) {
            return CompletableFuture.failedFuture(new ToolCallException("Unknown tool: " + name));
        }

        CompletableFuture<ToolResult> execution;
        try {
            execution = component.execute(arguments != null ? arguments : Map.of());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(
                    new ToolCallException("Tool '" + name + "' failed: " + e.getMessage(), e));
        }

        return execution.handle((result, ex) -> {
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                throw new CompletionException(
                        new ToolCallException("Tool '" + name + "' failed: " + cause.getMessage(), cause));
            }
            if (result == null) {
                return new ToolCallResult(List.of(), false);
            }
            if (!result.isSuccess()) {
                return ToolCallResult.error(result.getError());
            }
            return new ToolCallResult(result.getContent(), false);
        });
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        running = false;
        registry.clear();
    }
}
