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

import me.golemcore.bridge.domain.exception.ToolHostConnectionException;
import me.golemcore.bridge.domain.service.ToolSession;
import me.golemcore.bridge.port.outbound.ModelBackendPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Shared infrastructure beans and startup behavior.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and {@link ObjectMapper} beans</li>
 * <li>Logs startup information (provider, model, tool host, budgets)</li>
 * <li>Connects the tool session eagerly when
 * {@code bridge.tool-host.connect-on-startup} is true</li>
 * </ul>
 *
 * <p>
 * A failed eager connect is logged and left to the first prompt, which
 * connects lazily and reports the failure to its caller.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BridgeProperties properties;
    private final ToolSession toolSession;
    private final ModelBackendPort modelBackend;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Tool Bridge starting...");
        log.info("LLM Provider: {}", properties.getLlm().getProvider());
        log.info("Model: {}", modelBackend.getModel());
        log.info("Tool Host: {}", properties.getToolHost().getType());
        log.info("Max rounds: {}, generate timeout: {}s, tool call timeout: {}s",
                properties.getToolLoop().getMaxRounds(),
                properties.getToolLoop().getGenerateTimeoutSeconds(),
                properties.getToolHost().getToolCallTimeoutSeconds());
        if (!modelBackend.isAvailable()) {
            log.warn("No API key configured for provider '{}', prompts will fail until one is set",
                    properties.getLlm().getProvider());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void connectOnStartup() {
        if (!properties.getToolHost().isConnectOnStartup()) {
            return;
        }
        try {
            toolSession.connect();
        } catch (ToolHostConnectionException e) {
            log.error("Tool host connection on startup failed: {}", e.getMessage());
        }
    }
}
