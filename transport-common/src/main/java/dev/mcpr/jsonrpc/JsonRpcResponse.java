package dev.mcpr.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Successful answer to the request carrying the same id.
 */
public record JsonRpcResponse(RequestId id, JsonNode result) implements JsonRpcMessage {

    public JsonRpcResponse {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(result, "result");
    }
}
