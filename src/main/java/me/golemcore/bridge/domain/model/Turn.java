package me.golemcore.bridge.domain.model;

import java.util.List;

/**
 * One role-tagged contribution to a conversation.
 */
public record Turn(Role role, List<Part> parts) {

    public enum Role {
        MODEL, USER
    }

    public Turn {
        if (role == null) {
            throw new IllegalArgumentException("Turn role is required");
        }
        parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static Turn model(List<Part> parts) {
        return new Turn(Role.MODEL, parts);
    }

    public static Turn user(List<? extends Part> parts) {
        return new Turn(Role.USER, List.copyOf(parts));
    }

    public List<FunctionCallPart> functionCalls() {
        return parts.stream()
                .filter(FunctionCallPart.class::isInstance)
                .map(FunctionCallPart.class::cast)
                .toList();
    }

    public List<FunctionResultPart> functionResults() {
        return parts.stream()
                .filter(FunctionResultPart.class::isInstance)
                .map(FunctionResultPart.class::cast)
                .toList();
    }
}
