package me.golemcore.bridge.domain.model;

/**
 * One element of a conversation turn. Implementations are {@link TextPart},
 * {@link FunctionCallPart} and {@link FunctionResultPart}.
 */
public interface Part {

    default boolean isText() {
        return this instanceof TextPart;
    }

    default boolean isFunctionCall() {
        return this instanceof FunctionCallPart;
    }

    default boolean isFunctionResult() {
        return this instanceof FunctionResultPart;
    }
}
