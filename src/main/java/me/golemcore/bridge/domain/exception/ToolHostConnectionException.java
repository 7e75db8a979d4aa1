package me.golemcore.bridge.domain.exception;

/**
 * The channel to the tool host could not be established: the handshake or the
 * initial tool listing did not complete.
 */
public class ToolHostConnectionException extends ToolBridgeException {

    private static final long serialVersionUID = 1L;

    public ToolHostConnectionException(String message) {
        super(message);
    }

    public ToolHostConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
