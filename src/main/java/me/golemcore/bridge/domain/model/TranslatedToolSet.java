package me.golemcore.bridge.domain.model;

import dev.langchain4j.agent.tool.ToolSpecification;

import java.util.List;

/**
 * Model-native declarations of every tool the session exposes, plus the
 * diagnostics collected while translating them. Built once per connect and
 * shared read-only between conversations.
 *
 * @param specifications
 *            translated function declarations, in tool host order
 * @param diagnostics
 *            one line per dropped property or tool
 */
public record TranslatedToolSet(List<ToolSpecification> specifications, List<String> diagnostics) {

    public TranslatedToolSet {
        specifications = specifications != null ? List.copyOf(specifications) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }

    public static TranslatedToolSet empty() {
        return new TranslatedToolSet(List.of(), List.of());
    }

    public boolean isEmpty() {
        return specifications.isEmpty();
    }

    public int size() {
        return specifications.size();
    }
}
