package me.golemcore.bridge.domain.exception;

/**
 * The tool host could not be reached at all, e.g. its process could not be
 * spawned.
 */
public class HostUnavailableException extends ToolHostConnectionException {

    private static final long serialVersionUID = 1L;

    public HostUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
