package me.golemcore.bridge.domain.component;

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

import me.golemcore.bridge.domain.model.ToolResult;
import me.golemcore.bridge.domain.model.ToolSpec;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A tool served by the in-process tool host.
 *
 * <p>
 * Implementations report host-side problems such as bad arguments as a failed
 * {@link ToolResult}; an exception thrown from {@link #execute(Map)} or
 * completing its future is reported to the model as a tool error as well.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool name, description and parameter schema.
     */
    ToolSpec getSpec();

    /**
     * Executes the tool with already parsed arguments.
     *
     * @param parameters
     *            the call arguments, never {@code null}
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getSpec().getName();
    }
}
