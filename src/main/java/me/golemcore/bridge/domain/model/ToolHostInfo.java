package me.golemcore.bridge.domain.model;

/**
 * Identity the tool host announced during the handshake.
 *
 * @param name
 *            server name, or a transport label when the host does not report
 *            one
 * @param version
 *            server version, may be {@code null}
 * @param protocolVersion
 *            negotiated protocol version
 */
public record ToolHostInfo(String name, String version, String protocolVersion) {
}
