package me.golemcore.bridge.domain.model;

/**
 * Plain text emitted by the model or supplied by the user.
 */
public record TextPart(String text) implements Part {

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
