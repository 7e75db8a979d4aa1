package me.golemcore.bridge.domain.exception;

/**
 * A tool or one of its properties could not be translated into a model-native
 * declaration. Always absorbed by the translator.
 */
public class SchemaTranslationException extends ToolBridgeException {

    private static final long serialVersionUID = 1L;

    public SchemaTranslationException(String message) {
        super(message);
    }
}
