package dev.mcpr.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A request without an id. Nothing is sent back for it.
 */
public record JsonRpcNotification(String method, JsonNode params) implements JsonRpcMessage {

    @Override
    public RequestId id() {
        return null;
    }
}
