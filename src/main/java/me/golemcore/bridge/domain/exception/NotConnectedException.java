package me.golemcore.bridge.domain.exception;

/**
 * A session operation was used before {@code connect()} or after
 * {@code close()}.
 */
public class NotConnectedException extends ToolBridgeException {

    private static final long serialVersionUID = 1L;

    public NotConnectedException(String message) {
        super(message);
    }
}
