package dev.mcpr.error;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Single checked exception type for every MCP failure. Callers branch on {@link #kind()}.
 */
public class McpException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final String detail;
    private final Integer rpcCode;

    public McpException(ErrorKind kind, String detail) {
        this(kind, detail, null, null);
    }

    public McpException(ErrorKind kind, String detail, Throwable cause) {
        this(kind, detail, null, cause);
    }

    private McpException(ErrorKind kind, String detail, Integer rpcCode, Throwable cause) {
        super(render(kind, detail), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.detail = detail;
        this.rpcCode = rpcCode;
    }

    public static McpException transport(String detail) {
        return new McpException(ErrorKind.TRANSPORT, detail);
    }

    public static McpException transport(String detail, Throwable cause) {
        return new McpException(ErrorKind.TRANSPORT, detail, cause);
    }

    public static McpException serialization(String detail, Throwable cause) {
        return new McpException(ErrorKind.SERIALIZATION, detail, cause);
    }

    public static McpException deserialization(String detail) {
        return new McpException(ErrorKind.DESERIALIZATION, detail);
    }

    public static McpException deserialization(String detail, Throwable cause) {
        return new McpException(ErrorKind.DESERIALIZATION, detail, cause);
    }

    public static McpException protocol(String detail) {
        return new McpException(ErrorKind.PROTOCOL, detail);
    }

    /**
     * Protocol failure that embeds the error reported by the remote side.
     */
    public static McpException protocol(String detail, int rpcCode) {
        return new McpException(ErrorKind.PROTOCOL, detail, rpcCode, null);
    }

    public static McpException notFound(String detail) {
        return new McpException(ErrorKind.NOT_FOUND, detail);
    }

    public static McpException invalidRequest(String detail) {
        return new McpException(ErrorKind.INVALID_REQUEST, detail);
    }

    public static McpException authentication(String detail) {
        return new McpException(ErrorKind.AUTHENTICATION, detail);
    }

    public static McpException authorization(String detail) {
        return new McpException(ErrorKind.AUTHORIZATION, detail);
    }

    public static McpException state(String detail) {
        return new McpException(ErrorKind.STATE, detail);
    }

    public static McpException transition(String detail) {
        return new McpException(ErrorKind.TRANSITION, detail);
    }

    public static McpException alreadyConnected() {
        return new McpException(ErrorKind.ALREADY_CONNECTED, "Already connected");
    }

    public static McpException notConnected() {
        return new McpException(ErrorKind.NOT_CONNECTED, "Not connected");
    }

    public static McpException timeout() {
        return new McpException(ErrorKind.TIMEOUT, "Operation timed out");
    }

    public static McpException internal(String detail) {
        return new McpException(ErrorKind.INTERNAL, detail);
    }

    public static McpException internal(String detail, Throwable cause) {
        return new McpException(ErrorKind.INTERNAL, detail, cause);
    }

    public ErrorKind kind() {
        return kind;
    }

    /**
     * The message without the kind prefix.
     */
    public String detail() {
        return detail;
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    /**
     * JSON-RPC error code reported by the peer, present only for protocol errors built from an error frame.
     */
    public OptionalInt rpcCode() {
        return rpcCode == null ? OptionalInt.empty() : OptionalInt.of(rpcCode);
    }

    private static String render(ErrorKind kind, String detail) {
        if (detail == null || detail.isEmpty()) {
            return kind.label();
        }
        return kind.label() + ": " + detail;
    }
}
