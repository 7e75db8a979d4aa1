package me.golemcore.bridge.domain.exception;

/**
 * The channel to the tool host died while a request was in flight. The session
 * must be reconnected before reuse.
 */
public class SessionBrokenException extends ToolBridgeException {

    private static final long serialVersionUID = 1L;

    public SessionBrokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
