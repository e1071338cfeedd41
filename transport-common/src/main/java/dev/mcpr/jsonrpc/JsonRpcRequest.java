package dev.mcpr.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * @param id correlation id, never {@code null}
 * @param method method name
 * @param params optional parameters, {@code null} when absent
 */
public record JsonRpcRequest(RequestId id, String method, JsonNode params) implements JsonRpcMessage {

    public JsonRpcRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
    }
}
