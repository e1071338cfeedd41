package dev.mcpr.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mcpr.error.ErrorKind;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.McpProtocol;

/**
 * Turns one line or frame of text into a typed {@link JsonRpcMessage} and back.
 */
public final class JsonRpcCodec {

    private final ObjectMapper mapper;

    public JsonRpcCodec() {
        this(new ObjectMapper());
    }

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Decode a document.
     * @throws McpException {@link ErrorKind#DESERIALIZATION} for text that is not JSON,
     * {@link ErrorKind#INVALID_REQUEST} for JSON that is not a valid JSON-RPC 2.0 message
     */
    public JsonRpcMessage decode(String text) throws McpException {
        JsonNode tree = parseTree(text);
        if (!tree.isObject()) {
            throw McpException.invalidRequest("JSON-RPC message must be an object");
        }
        JsonNode version = tree.get("jsonrpc");
        if (version == null || !McpProtocol.JSONRPC_VERSION.equals(version.asText(null))) {
            throw McpException.invalidRequest("Unsupported or missing jsonrpc version");
        }
        JsonNode idNode = tree.get("id");
        boolean hasId = idNode != null && !idNode.isNull();
        RequestId id = RequestId.fromJson(idNode);
        if (hasId && id == null) {
            throw McpException.invalidRequest("id must be a number or a string");
        }

        if (tree.has("method")) {
            JsonNode method = tree.get("method");
            if (!method.isTextual() || method.textValue().isEmpty()) {
                throw McpException.invalidRequest("method must be a non-empty string");
            }
            JsonNode params = tree.get("params");
            if (params != null && params.isNull()) {
                params = null;
            }
            return hasId ? new JsonRpcRequest(id, method.textValue(), params)
                : new JsonRpcNotification(method.textValue(), params);
        }
        if (tree.has("result")) {
            if (id == null) {
                throw McpException.invalidRequest("Response without id");
            }
            return new JsonRpcResponse(id, tree.get("result"));
        }
        if (tree.has("error")) {
            JsonNode error = tree.get("error");
            if (!error.isObject() || !error.path("code").canConvertToInt() || !error.path("code").isIntegralNumber()) {
                throw McpException.invalidRequest("error must be an object with an integer code");
            }
            JsonNode data = error.get("data");
            return new JsonRpcError(id, error.get("code").intValue(), error.path("message").asText(""),
                data == null || data.isNull() ? null : data);
        }
        throw McpException.invalidRequest("Missing method");
    }

    public String encode(JsonRpcMessage message) throws McpException {
        try {
            return mapper.writeValueAsString(toTree(message));
        } catch (JsonProcessingException e) {
            throw McpException.serialization(e.getOriginalMessage(), e);
        }
    }

    public ObjectNode toTree(JsonRpcMessage message) {
        ObjectNode node = mapper.createObjectNode();
        node.put("jsonrpc", McpProtocol.JSONRPC_VERSION);
        if (message instanceof JsonRpcRequest request) {
            node.set("id", request.id().toJson());
            node.put("method", request.method());
            if (request.params() != null) {
                node.set("params", request.params());
            }
        } else if (message instanceof JsonRpcNotification notification) {
            node.put("method", notification.method());
            if (notification.params() != null) {
                node.set("params", notification.params());
            }
        } else if (message instanceof JsonRpcResponse response) {
            node.set("id", response.id().toJson());
            node.set("result", response.result());
        } else if (message instanceof JsonRpcError error) {
            if (error.id() != null) {
                node.set("id", error.id().toJson());
            } else {
                node.putNull("id");
            }
            ObjectNode body = node.putObject("error");
            body.put("code", error.code());
            body.put("message", error.message());
            if (error.data() != null) {
                body.set("data", error.data());
            }
        } else {
            throw new IllegalArgumentException("Unsupported JSON-RPC message type: " + message.getClass());
        }
        return node;
    }

    /**
     * Build the error frame answering a document that {@link #decode(String)} refused.
     * Parse errors never carry an id; invalid requests carry the id when one can be extracted.
     */
    public JsonRpcError rejection(String text, McpException cause) {
        if (cause.kind() == ErrorKind.DESERIALIZATION) {
            return new JsonRpcError(null, ErrorCodes.PARSE_ERROR, "Parse error", mapper.createObjectNode()
                .put("message", cause.detail()));
        }
        return new JsonRpcError(extractId(text), ErrorCodes.INVALID_REQUEST, "Invalid Request: " + cause.detail());
    }

    /**
     * Best effort id extraction from arbitrary text.
     * @return the id, or {@code null} when the text is not an object with a usable id
     */
    public RequestId extractId(String text) {
        try {
            JsonNode tree = mapper.readTree(text);
            return tree != null && tree.isObject() ? RequestId.fromJson(tree.get("id")) : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private JsonNode parseTree(String text) throws McpException {
        if (text == null || text.isBlank()) {
            throw McpException.deserialization("Empty message");
        }
        try {
            JsonNode tree = mapper.readTree(text);
            if (tree == null || tree.isMissingNode()) {
                throw McpException.deserialization("Empty message");
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw McpException.deserialization(e.getOriginalMessage(), e);
        }
    }
}
