package me.golemcore.bridge.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration properties for the tool bridge, bound from
 * application.properties.
 *
 * <p>
 * Everything lives under the {@code bridge.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - model backend provider, model and credentials</li>
 * <li>{@link ToolHostProperties} - tool host transport and call timeout</li>
 * <li>{@link ToolLoopProperties} - round budget and generate timeout</li>
 * </ul>
 *
 * <p>
 * Bound once at startup and handed to adapters through their constructors.
 */
@Component
@ConfigurationProperties(prefix = "bridge")
@Data
public class BridgeProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolHostProperties toolHost = new ToolHostProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();

    @Data
    public static class LlmProperties {

        /**
         * One of {@code openai}, {@code anthropic}, {@code gemini}.
         */
        private String provider = "gemini";
        private String model = "gemini-2.0-flash";
        private Double temperature = 0.7;
        private long timeoutMs = 120_000L;
        private Integer maxTokens = 4096;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class ToolHostProperties {

        /**
         * {@code mcp} spawns an external MCP server; {@code in-process}
         * dispatches to the built-in tool components.
         */
        private String type = "in-process";
        private boolean connectOnStartup = false;
        private int toolCallTimeoutSeconds = 60;
        private McpProperties mcp = new McpProperties();
    }

    @Data
    public static class McpProperties {
        private String name = "mcp";
        private String command;
        private Map<String, String> env = new HashMap<>();
        private int startupTimeoutSeconds = 30;
    }

    @Data
    public static class ToolLoopProperties {
        private int maxRounds = 10;
        private long generateTimeoutSeconds = 120;
    }
}
