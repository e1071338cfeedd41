package dev.mcpr.jsonrpc;

/**
 * Standard JSON-RPC error codes plus the application execution code.
 */
public final class ErrorCodes {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int EXECUTION_ERROR = -32000;

    private ErrorCodes() {
    }
}
