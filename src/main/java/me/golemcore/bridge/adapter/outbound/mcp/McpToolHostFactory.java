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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.domain.model.McpConfig;
import me.golemcore.bridge.infrastructure.config.BridgeProperties;
import me.golemcore.bridge.port.outbound.ToolHostFactory;
import me.golemcore.bridge.port.outbound.ToolHostPort;

import java.util.HashMap;

/**
 * Creates a fresh {@link McpClient} for every session connect, configured from
 * {@code bridge.tool-host.mcp.*}.
 *
 * <p>
 * Non-positive timeouts fall back to the {@link McpConfig} defaults.
 */
@Slf4j
public class McpToolHostFactory implements ToolHostFactory {

    private final BridgeProperties properties;
    private final ObjectMapper objectMapper;

    public McpToolHostFactory(BridgeProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolHostPort create() {
        McpConfig config = buildConfig();
        log.debug("[McpFactory] Creating MCP client '{}'", config.getName());
        return new McpClient(config, objectMapper);
    }

    McpConfig buildConfig() {
        BridgeProperties.ToolHostProperties toolHost = properties.getToolHost();
        BridgeProperties.McpProperties mcp = toolHost.getMcp();
        McpConfig defaults = McpConfig.builder().build();

        return McpConfig.builder()
                .name(mcp.getName() != null && !mcp.getName().isBlank() ? mcp.getName() : "mcp")
                .command(mcp.getCommand())
                .env(mcp.getEnv() != null ? new HashMap<>(mcp.getEnv()) : new HashMap<>())
                .startupTimeoutSeconds(mcp.getStartupTimeoutSeconds() > 0
                        ? mcp.getStartupTimeoutSeconds()
                        : defaults.getStartupTimeoutSeconds())
                .requestTimeoutSeconds(toolHost.getToolCallTimeoutSeconds() > 0
                        ? toolHost.getToolCallTimeoutSeconds()
                        : defaults.getRequestTimeoutSeconds())
                .build();
    }
}
