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
import lombok.Data;

import java.util.List;

/**
 * Result of one tool invocation as seen by the orchestration loop: either the
 * ordered text segments the tool produced, or an error message with its
 * failure kind. Consumed within the round that produced it.
 */
@Data
@Builder
public class ToolResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;

    @Builder.Default
    private List<String> content = List.of();

    private String error;
    private ToolFailureKind failureKind;

    /**
     * Creates a successful result from ordered text segments.
     */
    public static ToolResult success(List<String> content) {
        return ToolResult.builder()
                .success(true)
                .content(content != null ? List.copyOf(content) : List.of())
                .build();
    }

    /**
     * Creates a successful result with a single text segment.
     */
    public static ToolResult success(String output) {
        return success(output != null ? List.of(output) : List.of());
    }

    /**
     * Creates a failed result reported by the tool host.
     */
    public static ToolResult failure(String error) {
        return failure(ToolFailureKind.TOOL_ERROR, error);
    }

    /**
     * Creates a failed result with an explicit failure kind.
     */
    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }

    /**
     * Text segments joined with newlines.
     */
    public String getOutput() {
        return content != null ? String.join("\n", content) : "";
    }
}
