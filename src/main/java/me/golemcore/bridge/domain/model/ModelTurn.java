package me.golemcore.bridge.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a single generate call returned: the ordered parts plus usage
 * accounting.
 */
@Value
@Builder
public class ModelTurn {

    @Builder.Default
    List<Part> parts = List.of();

    LlmUsage usage;
    String model;
    String finishReason;

    public List<FunctionCallPart> functionCalls() {
        if (parts == null) {
            return List.of();
        }
        return parts.stream()
                .filter(FunctionCallPart.class::isInstance)
                .map(FunctionCallPart.class::cast)
                .toList();
    }

    public List<TextPart> textParts() {
        if (parts == null) {
            return List.of();
        }
        return parts.stream()
                .filter(TextPart.class::isInstance)
                .map(TextPart.class::cast)
                .toList();
    }

    public boolean hasFunctionCalls() {
        return !functionCalls().isEmpty();
    }

    /**
     * Model-role turn holding the raw parts, as appended to the conversation.
     */
    public Turn toTurn() {
        return Turn.model(parts != null ? parts : List.of());
    }

    public static ModelTurn text(String text) {
        return ModelTurn.builder()
                .parts(List.of(new TextPart(text)))
                .build();
    }

    public static ModelTurn of(Part... parts) {
        return ModelTurn.builder()
                .parts(List.of(parts))
                .build();
    }
}
