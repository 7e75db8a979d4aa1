package me.golemcore.bridge.domain.exception;

/**
 * The tool host rejected or failed a single tool call. Used to complete tool
 * call futures; never fatal to the session.
 */
public class ToolCallException extends Exception {

    private static final long serialVersionUID = 1L;

    public ToolCallException(String message) {
        super(message);
    }

    public ToolCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
