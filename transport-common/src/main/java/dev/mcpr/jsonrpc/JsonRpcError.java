package dev.mcpr.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Error answer. The id is {@code null} when it could not be recovered from the request.
 * @param id id of the request being answered, or {@code null}
 * @param code JSON-RPC error code, see {@link ErrorCodes}
 * @param message error message
 * @param data optional structured detail
 */
public record JsonRpcError(RequestId id, int code, String message, JsonNode data) implements JsonRpcMessage {

    public JsonRpcError {
        Objects.requireNonNull(message, "message");
    }

    public JsonRpcError(RequestId id, int code, String message) {
        this(id, code, message, null);
    }
}
