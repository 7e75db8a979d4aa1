package me.golemcore.bridge.port.outbound;

/**
 * Creates a fresh, unconnected tool host channel. Called on every (re)connect
 * of a tool session.
 */
@FunctionalInterface
public interface ToolHostFactory {

    ToolHostPort create();
}
