package me.golemcore.bridge.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * A tool exposed by the tool host: a stable name, a human description, and the
 * schema of its input parameters. Produced once per session and immutable
 * afterwards.
 */
@Value
@Builder
public class ToolSpec {

    String name;
    String description;

    @Builder.Default
    SchemaNode parameterSchema = SchemaNode.emptyObject();

    /**
     * Creates a tool spec without input parameters.
     */
    public static ToolSpec simple(String name, String description) {
        return ToolSpec.builder()
                .name(name)
                .description(description)
                .build();
    }
}
