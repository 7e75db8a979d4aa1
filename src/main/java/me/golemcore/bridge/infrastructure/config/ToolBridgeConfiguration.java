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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bridge.adapter.outbound.inprocess.InProcessToolHost;
import me.golemcore.bridge.adapter.outbound.llm.ChatModelFactory;
import me.golemcore.bridge.adapter.outbound.llm.Langchain4jModelBackend;
import me.golemcore.bridge.adapter.outbound.mcp.McpToolHostFactory;
import me.golemcore.bridge.domain.component.ToolComponent;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import me.golemcore.bridge.port.outbound.ToolHostFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the outbound adapters: the tool host transport selected by
 * {@code bridge.tool-host.type} and the langchain4j model backend.
 */
@Configuration
@Slf4j
public class ToolBridgeConfiguration {

    static final String HOST_TYPE_MCP = "mcp";
    static final String HOST_TYPE_IN_PROCESS = "in-process";

    @Bean
    public ToolHostFactory toolHostFactory(BridgeProperties properties, ObjectMapper objectMapper,
            List<ToolComponent> toolComponents) {
        String type = properties.getToolHost().getType();
        if (HOST_TYPE_MCP.equalsIgnoreCase(type)) {
            log.info("Tool host: MCP server '{}'", properties.getToolHost().getMcp().getName());
            return new McpToolHostFactory(properties, objectMapper);
        }
        if (type == null || HOST_TYPE_IN_PROCESS.equalsIgnoreCase(type)) {
            log.info("Tool host: in-process ({} tool components)", toolComponents.size());
            return () -> new InProcessToolHost(toolComponents);
        }
        throw new IllegalStateException("Unknown tool host type: " + type
                + ". Use bridge.tool-host.type=mcp or in-process");
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService modelBackendExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "model-backend-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ModelBackendPort modelBackend(BridgeProperties properties, ObjectMapper objectMapper,
            @Qualifier("modelBackendExecutor") ExecutorService modelBackendExecutor) {
        return new Langchain4jModelBackend(new ChatModelFactory(properties.getLlm()), objectMapper,
                modelBackendExecutor);
    }
}
