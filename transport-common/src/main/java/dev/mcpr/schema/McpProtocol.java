package dev.mcpr.schema;

/**
 * Protocol level constants shared by client and server.
 */
public final class McpProtocol {

    public static final String JSONRPC_VERSION = "2.0";
    public static final String LATEST_PROTOCOL_VERSION = "0.1.0";

    private McpProtocol() {
    }
}
