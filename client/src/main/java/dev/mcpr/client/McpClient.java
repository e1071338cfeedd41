package dev.mcpr.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mcpr.error.McpException;
import dev.mcpr.jsonrpc.JsonRpcCodec;
import dev.mcpr.jsonrpc.JsonRpcError;
import dev.mcpr.jsonrpc.JsonRpcMessage;
import dev.mcpr.jsonrpc.JsonRpcRequest;
import dev.mcpr.jsonrpc.JsonRpcResponse;
import dev.mcpr.jsonrpc.RequestId;
import dev.mcpr.schema.Implementation;
import dev.mcpr.schema.McpProtocol;
import dev.mcpr.schema.Prompt;
import dev.mcpr.schema.PromptMessage;
import dev.mcpr.schema.Resource;
import dev.mcpr.schema.ResourceContents;
import dev.mcpr.schema.ResourceTemplate;
import dev.mcpr.schema.Tool;
import dev.mcpr.transport.Transport;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous MCP client. Requests are issued one at a time and each call blocks until the response
 * carrying its id arrives; unrelated documents received in between are skipped.
 */
public class McpClient implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpClient.class);

    private static final TypeReference<List<Tool>> TOOLS = new TypeReference<>() {
    };
    private static final TypeReference<List<Prompt>> PROMPTS = new TypeReference<>() {
    };
    private static final TypeReference<List<PromptMessage>> MESSAGES = new TypeReference<>() {
    };
    private static final TypeReference<List<Resource>> RESOURCES = new TypeReference<>() {
    };
    private static final TypeReference<List<ResourceTemplate>> TEMPLATES = new TypeReference<>() {
    };

    private final Transport transport;
    private final ObjectMapper mapper;
    private final JsonRpcCodec codec;
    private final String protocolVersion;
    private final Implementation clientInfo;
    private final ObjectNode capabilities;
    private final AtomicLong nextId = new AtomicLong(1);

    private volatile Implementation serverInfo;
    private volatile JsonNode serverCapabilities;
    private volatile List<Tool> initializationTools = List.of();

    private McpClient(Builder builder) {
        this.transport = builder.transport;
        this.mapper = builder.mapper;
        this.codec = new JsonRpcCodec(mapper);
        this.protocolVersion = builder.protocolVersion;
        this.clientInfo = builder.clientInfo;
        this.capabilities = builder.capabilities == null ? mapper.createObjectNode() : builder.capabilities;
    }

    public static Builder builder(Transport transport) {
        return new Builder(transport);
    }

    /**
     * Start the transport and perform the initialize handshake. On failure the transport is left
     * running so the caller can retry or shut down explicitly.
     * @return the server identity
     */
    public Implementation initialize() throws McpException {
        transport.start();
        ObjectNode params = mapper.createObjectNode();
        params.put("protocol_version", protocolVersion);
        params.set("capabilities", capabilities);
        params.set("client_info", mapper.valueToTree(clientInfo));

        JsonNode result = request("initialize", params);
        JsonNode info = result.get("server_info");
        if (info == null || !info.isObject()) {
            throw McpException.protocol("Missing server_info in initialize response");
        }
        Implementation server = convert(info, Implementation.class);
        JsonNode tools = result.get("tools");
        initializationTools = tools == null || tools.isNull() ? List.of() : convert(tools, TOOLS);
        serverCapabilities = result.path("capabilities");
        serverInfo = server;
        LOGGER.info("Initialized with {} {} (protocol {}), {} tools", server.name(), server.version(),
            result.path("protocol_version").asText("?"), initializationTools.size());
        return server;
    }

    /**
     * Call a tool through {@code tool_call} and return the unwrapped result.
     */
    public JsonNode callTool(String name, JsonNode parameters) throws McpException {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", name);
        params.set("parameters", parameters == null ? mapper.createObjectNode() : parameters);
        JsonNode result = request("tool_call", params);
        if (!result.has("result")) {
            throw McpException.protocol("Missing result in tool_call response");
        }
        return result.get("result");
    }

    public <T> T callTool(String name, Object parameters, Class<T> resultType) throws McpException {
        JsonNode tree = parameters == null ? null : mapper.valueToTree(parameters);
        return convert(callTool(name, tree), resultType);
    }

    public List<Tool> listTools() throws McpException {
        return convert(request("tools/list", null).path("tools"), TOOLS);
    }

    /**
     * Tool listing received with the initialize response; no round trip.
     */
    public List<Tool> getInitializationTools() {
        return initializationTools;
    }

    public List<Prompt> getPrompts() throws McpException {
        return convert(request("prompts/list", null).path("prompts"), PROMPTS);
    }

    public List<PromptMessage> getPromptMessages(String name, JsonNode arguments) throws McpException {
        ObjectNode params = mapper.createObjectNode();
        params.put("name", name);
        params.set("arguments", arguments == null ? mapper.createObjectNode() : arguments);
        return convert(request("prompts/get", params).path("messages"), MESSAGES);
    }

    public List<Resource> getResources() throws McpException {
        return convert(request("resources/list", null).path("resources"), RESOURCES);
    }

    public List<ResourceTemplate> getResourceTemplates() throws McpException {
        return convert(request("resources/templates/list", null).path("resourceTemplates"), TEMPLATES);
    }

    public ResourceContents getResource(String uri) throws McpException {
        ObjectNode params = mapper.createObjectNode();
        params.put("uri", uri);
        JsonNode resource = request("resources/get", params).get("resource");
        if (resource == null || !resource.isObject()) {
            throw McpException.protocol("Missing resource in resources/get response");
        }
        return convert(resource, ResourceContents.class);
    }

    /**
     * Server identity from the last successful {@link #initialize()}, or {@code null}.
     */
    public Implementation getServerInfo() {
        return serverInfo;
    }

    public JsonNode getServerCapabilities() {
        return serverCapabilities;
    }

    /**
     * Ask the server to shut down, then close the transport whatever the answer. An acknowledgement
     * that cannot be decoded counts as success.
     */
    public void shutdown() throws McpException {
        try {
            RequestId id = send("shutdown", null);
            awaitResponse(id, true);
            LOGGER.info("Server acknowledged shutdown");
        } finally {
            transport.close();
        }
    }

    @Override
    public void close() {
        transport.close();
    }

    private JsonNode request(String method, JsonNode params) throws McpException {
        RequestId id = send(method, params);
        return awaitResponse(id, false);
    }

    private RequestId send(String method, JsonNode params) throws McpException {
        RequestId id = RequestId.of(nextId.getAndIncrement());
        transport.sendText(codec.encode(new JsonRpcRequest(id, method, params)));
        return id;
    }

    /**
     * Block until the answer to {@code id} arrives.
     * @param lenient treat an undecodable document as an empty successful answer
     */
    private JsonNode awaitResponse(RequestId id, boolean lenient) throws McpException {
        while (true) {
            String text = transport.receiveText();
            JsonRpcMessage message;
            try {
                message = codec.decode(text);
            } catch (McpException e) {
                if (lenient) {
                    LOGGER.warn("Malformed answer to request {} accepted: {}", id, e.getMessage());
                    return mapper.createObjectNode();
                }
                LOGGER.warn("Skipping undecodable message: {}", e.getMessage());
                continue;
            }
            if (message instanceof JsonRpcError error && (error.id() == null || id.equals(error.id()))) {
                throw McpException.protocol(error.message(), error.code());
            }
            if (message instanceof JsonRpcResponse response && id.equals(response.id())) {
                return response.result();
            }
            LOGGER.debug("Skipping message not answering request {}: {}", id, text);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) throws McpException {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw McpException.deserialization("Cannot read " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type) throws McpException {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw McpException.protocol("Missing listing in response");
        }
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw McpException.deserialization(e.getMessage(), e);
        }
    }

    public static final class Builder {

        private final Transport transport;
        private ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        private String protocolVersion = McpProtocol.LATEST_PROTOCOL_VERSION;
        private Implementation clientInfo = new Implementation("mcpr-client", "0.1.0");
        private ObjectNode capabilities;

        private Builder(Transport transport) {
            if (transport == null) {
                throw new IllegalArgumentException("transport must not be null");
            }
            this.transport = transport;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder protocolVersion(String protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder clientInfo(String name, String version) {
            this.clientInfo = new Implementation(name, version);
            return this;
        }

        public Builder capabilities(ObjectNode capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public McpClient build() {
            return new McpClient(this);
        }
    }
}
