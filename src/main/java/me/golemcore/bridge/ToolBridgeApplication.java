package me.golemcore.bridge;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Tool Bridge.
 *
 * <p>
 * The bridge lets a tool-calling language model use the tools of an MCP server
 * (or of the built-in in-process host) through a bounded orchestration loop.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ChatController, ToolSessionController
 * Domain Layer       → OrchestrationLoop, ToolSession, SchemaTranslator
 * Infrastructure     → MCP / in-process tool hosts, langchain4j model backend
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code bridge.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ToolBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolBridgeApplication.class, args);
    }

}
