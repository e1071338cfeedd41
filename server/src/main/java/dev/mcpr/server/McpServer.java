package dev.mcpr.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mcpr.error.ErrorKind;
import dev.mcpr.error.McpException;
import dev.mcpr.jsonrpc.ErrorCodes;
import dev.mcpr.jsonrpc.JsonRpcCodec;
import dev.mcpr.jsonrpc.JsonRpcError;
import dev.mcpr.jsonrpc.JsonRpcMessage;
import dev.mcpr.jsonrpc.JsonRpcNotification;
import dev.mcpr.jsonrpc.JsonRpcRequest;
import dev.mcpr.jsonrpc.JsonRpcResponse;
import dev.mcpr.jsonrpc.RequestId;
import dev.mcpr.schema.Implementation;
import dev.mcpr.schema.McpProtocol;
import dev.mcpr.schema.Tool;
import dev.mcpr.transport.Transport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous MCP server. {@link #start(Transport)} runs a receive-dispatch-reply loop on the
 * calling thread until a {@code shutdown} request, {@link #stop()}, or a run of consecutive
 * failures reaching {@code maxErrors}.
 * <p>
 * Connection sentinels and peer resets are transient: the loop sleeps and continues without
 * counting them. Every other failure counts; a successfully handled message resets the count.
 */
public final class McpServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpServer.class);

    public static final int DEFAULT_MAX_ERRORS = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(100);

    private final Implementation serverInfo;
    private final Map<String, Tool> tools;
    private final Map<String, ToolHandler> handlers = new ConcurrentHashMap<>();
    private final ToolsProvider toolsProvider;
    private final PromptsProvider promptsProvider;
    private final ResourcesProvider resourcesProvider;
    private final int maxErrors;
    private final Duration retryDelay;
    private final ObjectMapper mapper;
    private final JsonRpcCodec codec;

    private volatile Transport transport;
    private volatile boolean running;

    private McpServer(Builder builder) {
        this.serverInfo = new Implementation(builder.name, builder.version);
        this.tools = new LinkedHashMap<>(builder.tools);
        this.handlers.putAll(builder.handlers);
        this.toolsProvider = builder.toolsProvider;
        this.promptsProvider = builder.promptsProvider;
        this.resourcesProvider = builder.resourcesProvider;
        this.maxErrors = builder.maxErrors;
        this.retryDelay = builder.retryDelay;
        this.mapper = builder.mapper;
        this.codec = new JsonRpcCodec(mapper);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Implementation serverInfo() {
        return serverInfo;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Attach a handler to a tool declared on the builder or listed by the tools provider.
     * @throws McpException {@link ErrorKind#PROTOCOL} for an unknown tool,
     * {@link ErrorKind#INVALID_REQUEST} when the tool already has a handler
     */
    public void registerToolHandler(String name, ToolHandler handler) throws McpException {
        if (!isKnownTool(name)) {
            throw McpException.protocol("Tool '" + name + "' not found in server configuration");
        }
        if (handlers.putIfAbsent(name, handler) != null) {
            throw McpException.invalidRequest("Tool '" + name + "' already has a handler");
        }
        LOGGER.debug("Registered handler for tool {}", name);
    }

    /**
     * Start the transport and serve it until shutdown.
     * @throws McpException when the transport cannot be started or too many consecutive receive failures occur
     */
    public void start(Transport transport) throws McpException {
        transport.start();
        this.transport = transport;
        this.running = true;
        LOGGER.info("MCP server {} {} started", serverInfo.name(), serverInfo.version());
        try {
            runLoop(transport);
        } finally {
            running = false;
        }
        LOGGER.info("MCP server {} stopped", serverInfo.name());
    }

    /**
     * Leave the loop and close the transport. Safe to call from another thread.
     */
    public void stop() {
        running = false;
        Transport current = transport;
        if (current != null) {
            current.close();
        }
    }

    private void runLoop(Transport transport) throws McpException {
        int consecutiveErrors = 0;
        while (running) {
            try {
                String text = transport.receiveText();
                if (text.isBlank()) {
                    continue;
                }
                handleMessage(transport, text);
                consecutiveErrors = 0;
            } catch (McpException e) {
                if (!running) {
                    break;
                }
                if (isReset(e)) {
                    LOGGER.info("Peer reset the connection, waiting for it to come back");
                    consecutiveErrors = 0;
                    pause();
                    continue;
                }
                if (isTransient(e)) {
                    LOGGER.debug("Transient transport condition: {}", e.getMessage());
                    pause();
                    continue;
                }
                consecutiveErrors++;
                if (consecutiveErrors >= maxErrors) {
                    LOGGER.error("Giving up after {} consecutive errors, last: {}", consecutiveErrors, e.getMessage());
                    throw e;
                }
                LOGGER.warn("Error in server loop ({}/{}): {}", consecutiveErrors, maxErrors, e.getMessage());
                pause();
            }
        }
    }

    static boolean isTransient(McpException e) {
        return e.kind() == ErrorKind.NOT_CONNECTED || e.kind() == ErrorKind.ALREADY_CONNECTED;
    }

    static boolean isReset(McpException e) {
        String detail = e.detail();
        return e.kind() == ErrorKind.TRANSPORT && detail != null && detail.toLowerCase().contains("reset");
    }

    private void pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }

    private void handleMessage(Transport transport, String text) throws McpException {
        JsonRpcMessage message;
        try {
            message = codec.decode(text);
        } catch (McpException e) {
            LOGGER.warn("Rejecting malformed message: {}", e.getMessage());
            send(transport, codec.rejection(text, e));
            return;
        }
        if (message instanceof JsonRpcRequest request) {
            handleRequest(transport, request);
        } else if (message instanceof JsonRpcNotification notification) {
            LOGGER.debug("Ignoring notification {}", notification.method());
        } else {
            LOGGER.debug("Ignoring unsolicited {} for id {}", message.getClass().getSimpleName(), message.id());
        }
    }

    private void handleRequest(Transport transport, JsonRpcRequest request) throws McpException {
        LOGGER.debug("Handling {} (id {})", request.method(), request.id());
        if ("shutdown".equals(request.method())) {
            send(transport, new JsonRpcResponse(request.id(), mapper.createObjectNode()));
            LOGGER.info("Shutdown requested");
            running = false;
            transport.close();
            return;
        }
        JsonRpcMessage reply;
        try {
            reply = route(request);
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected failure handling {}", request.method(), e);
            reply = new JsonRpcError(request.id(), ErrorCodes.INTERNAL_ERROR, "Internal error",
                mapper.createObjectNode().put("message", String.valueOf(e.getMessage())));
        }
        send(transport, reply);
    }

    private JsonRpcMessage route(JsonRpcRequest request) {
        RequestId id = request.id();
        JsonNode params = request.params();
        return switch (request.method()) {
            case "initialize" -> new JsonRpcResponse(id, initializeResult());
            case "tool_call" -> callTool(id, params, false);
            case "tools/call" -> callTool(id, params, true);
            case "get_tools", "tools/list" -> listing(id, "tools", allTools());
            case "get_prompts", "prompts/list" -> promptsProvider == null
                ? noProvider(id, "prompts")
                : listing(id, "prompts", promptsProvider.getPrompts());
            case "get_prompt_messages", "prompts/get" -> promptMessages(id, params);
            case "get_resources", "resources/list" -> resourcesProvider == null
                ? noProvider(id, "resources")
                : listing(id, "resources", resourcesProvider.getResources());
            case "resources/templates/list" -> resourcesProvider == null
                ? noProvider(id, "resources")
                : listing(id, "resourceTemplates", resourcesProvider.getResourceTemplates());
            case "get_resource", "resources/get" -> resource(id, params);
            default -> error(id, ErrorCodes.METHOD_NOT_FOUND, "Method not found: " + request.method());
        };
    }

    private ObjectNode initializeResult() {
        List<Tool> toolList = allTools();
        ObjectNode result = mapper.createObjectNode();
        result.put("protocol_version", McpProtocol.LATEST_PROTOCOL_VERSION);
        ObjectNode capabilities = result.putObject("capabilities");
        if (!toolList.isEmpty()) {
            capabilities.putObject("tools").put("list_changed", false);
        }
        if (promptsProvider != null) {
            capabilities.putObject("prompts").put("list_changed", false);
        }
        if (resourcesProvider != null) {
            capabilities.putObject("resources").put("list_changed", false);
        }
        result.set("server_info", mapper.valueToTree(serverInfo));
        result.set("tools", mapper.valueToTree(toolList));
        return result;
    }

    private JsonRpcMessage callTool(RequestId id, JsonNode params, boolean contentResult) {
        if (params == null || !params.isObject()) {
            return error(id, ErrorCodes.INVALID_PARAMS, "Missing parameters in tool call request");
        }
        JsonNode nameNode = params.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            return error(id, ErrorCodes.INVALID_PARAMS, "Missing tool name in parameters");
        }
        String name = nameNode.textValue();
        JsonNode arguments = params.get(contentResult ? "arguments" : "parameters");
        if (arguments == null) {
            arguments = NullNode.instance;
        }

        JsonNode value;
        try {
            ToolHandler handler = handlers.get(name);
            if (handler != null) {
                value = handler.handle(arguments);
            } else if (!isKnownTool(name)) {
                return error(id, ErrorCodes.INVALID_PARAMS, "Unknown tool: " + name);
            } else if (toolsProvider != null) {
                value = toolsProvider.executeTool(name, arguments);
            } else {
                return error(id, ErrorCodes.INTERNAL_ERROR, "No handler registered for tool '" + name + "'");
            }
        } catch (McpException e) {
            LOGGER.warn("Tool {} failed: {}", name, e.getMessage());
            return error(id, ErrorCodes.EXECUTION_ERROR, "Tool execution failed: " + e.getMessage());
        }

        ObjectNode result = mapper.createObjectNode();
        if (!contentResult) {
            result.set("result", value == null ? NullNode.instance : value);
            return new JsonRpcResponse(id, result);
        }
        String text;
        try {
            text = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return error(id, ErrorCodes.INTERNAL_ERROR, "Internal error: " + e.getOriginalMessage());
        }
        result.putArray("content").addObject().put("type", "text").put("text", text);
        result.put("isError", false);
        return new JsonRpcResponse(id, result);
    }

    private JsonRpcMessage promptMessages(RequestId id, JsonNode params) {
        if (promptsProvider == null) {
            return noProvider(id, "prompts");
        }
        String name = params == null ? null : params.path("name").textValue();
        if (name == null) {
            return error(id, ErrorCodes.INVALID_PARAMS, "Missing prompt name in parameters");
        }
        JsonNode arguments = params.get("arguments");
        try {
            return listing(id, "messages", promptsProvider.getPromptMessages(name, arguments == null ? NullNode.instance : arguments));
        } catch (McpException e) {
            return error(id, ErrorCodes.EXECUTION_ERROR, e.getMessage());
        }
    }

    private JsonRpcMessage resource(RequestId id, JsonNode params) {
        if (resourcesProvider == null) {
            return noProvider(id, "resources");
        }
        String uri = params == null ? null : params.path("uri").textValue();
        if (uri == null) {
            return error(id, ErrorCodes.INVALID_PARAMS, "Missing resource uri in parameters");
        }
        try {
            ObjectNode result = mapper.createObjectNode();
            result.set("resource", mapper.valueToTree(resourcesProvider.getResource(uri)));
            return new JsonRpcResponse(id, result);
        } catch (McpException e) {
            return error(id, ErrorCodes.EXECUTION_ERROR, e.getMessage());
        }
    }

    private JsonRpcResponse listing(RequestId id, String field, List<?> items) {
        ObjectNode result = mapper.createObjectNode();
        result.set(field, mapper.valueToTree(items));
        return new JsonRpcResponse(id, result);
    }

    private JsonRpcError noProvider(RequestId id, String kind) {
        return error(id, ErrorCodes.INTERNAL_ERROR, "No " + kind + " provider registered");
    }

    private static JsonRpcError error(RequestId id, int code, String message) {
        return new JsonRpcError(id, code, message);
    }

    private void send(Transport transport, JsonRpcMessage message) throws McpException {
        transport.sendText(codec.encode(message));
    }

    /**
     * Declared tools first, then provider tools not shadowed by a declared one.
     */
    private List<Tool> allTools() {
        List<Tool> result = new ArrayList<>(tools.values());
        if (toolsProvider != null) {
            for (Tool tool : toolsProvider.getTools()) {
                if (!tools.containsKey(tool.name())) {
                    result.add(tool);
                }
            }
        }
        return result;
    }

    private boolean isKnownTool(String name) {
        if (tools.containsKey(name)) {
            return true;
        }
        return toolsProvider != null && toolsProvider.getTools().stream().anyMatch(tool -> tool.name().equals(name));
    }

    public static final class Builder {

        private String name = "MCP Server";
        private String version = "1.0.0";
        private final Map<String, Tool> tools = new LinkedHashMap<>();
        private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();
        private ToolsProvider toolsProvider;
        private PromptsProvider promptsProvider;
        private ResourcesProvider resourcesProvider;
        private int maxErrors = DEFAULT_MAX_ERRORS;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private ObjectMapper mapper = new ObjectMapper();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Declare a tool; its handler can be registered later.
         */
        public Builder tool(Tool tool) {
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool: " + tool.name());
            }
            return this;
        }

        public Builder tool(Tool tool, ToolHandler handler) {
            tool(tool);
            handlers.put(tool.name(), handler);
            return this;
        }

        public Builder toolsProvider(ToolsProvider toolsProvider) {
            this.toolsProvider = toolsProvider;
            return this;
        }

        public Builder promptsProvider(PromptsProvider promptsProvider) {
            this.promptsProvider = promptsProvider;
            return this;
        }

        public Builder resourcesProvider(ResourcesProvider resourcesProvider) {
            this.resourcesProvider = resourcesProvider;
            return this;
        }

        public Builder maxErrors(int maxErrors) {
            if (maxErrors < 1) {
                throw new IllegalArgumentException("maxErrors must be at least 1");
            }
            this.maxErrors = maxErrors;
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        public McpServer build() {
            return new McpServer(this);
        }
    }
}
