package me.golemcore.bridge.domain.exception;

/**
 * Root of the unchecked failures raised by the tool session and the
 * orchestration loop.
 */
public class ToolBridgeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ToolBridgeException(String message) {
        super(message);
    }

    public ToolBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
