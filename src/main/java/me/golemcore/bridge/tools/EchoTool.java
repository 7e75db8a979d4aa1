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

package me.golemcore.bridge.tools;

import me.golemcore.bridge.domain.component.ToolComponent;
import me.golemcore.bridge.domain.model.SchemaNode;
import me.golemcore.bridge.domain.model.SchemaType;
import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.ToolSpec;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Returns its {@code text} argument unchanged. Handy for checking that a model
 * backend and the tool loop are wired correctly.
 */
@Component
public class EchoTool implements ToolComponent {

    @Override
    public ToolSpec getSpec() {
        return ToolSpec.builder()
                .name("echo")
                .description("Echo the given text back verbatim.")
                .parameterSchema(SchemaNode.object(
                        Map.of("text", SchemaNode.of(SchemaType.STRING, "Text to echo back")),
                        List.of("text")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object text = parameters.get("text");
        if (text == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Missing required parameter: text"));
        }
        return CompletableFuture.completedFuture(ToolResult.success(text.toString()));
    }
}
