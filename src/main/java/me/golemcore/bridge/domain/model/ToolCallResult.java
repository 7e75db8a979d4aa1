package me.golemcore.bridge.domain.model;

import java.util.List;

/**
 * Raw answer of the tool host to a {@code tools/call} request.
 *
 * @param content
 *            text segments in host order
 * @param isError
 *            whether the host flagged the result as a tool-level error
 */
public record ToolCallResult(List<String> content, boolean isError) {

    public ToolCallResult {
        content = content != null ? List.copyOf(content) : List.of();
    }

    public static ToolCallResult text(String... segments) {
        return new ToolCallResult(List.of(segments), false);
    }

    public static ToolCallResult error(String message) {
        return new ToolCallResult(message != null ? List.of(message) : List.of(), true);
    }
}
