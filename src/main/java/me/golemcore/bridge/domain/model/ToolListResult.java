package me.golemcore.bridge.domain.model;

import java.util.List;

/**
 * Tools reported by the tool host in a single listing.
 */
public record ToolListResult(List<ToolSpec> tools) {

    public ToolListResult {
        tools = tools != null ? List.copyOf(tools) : List.of();
    }
}
