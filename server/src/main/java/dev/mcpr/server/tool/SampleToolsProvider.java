package dev.mcpr.server.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.Tool;
import dev.mcpr.server.ToolsProvider;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Demonstration tools: {@code echo} returns its parameters, {@code add} sums two numbers.
 */
@Component
@RequiredArgsConstructor
public class SampleToolsProvider implements ToolsProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(SampleToolsProvider.class);

    private final ObjectMapper objectMapper;

    @Override
    public List<Tool> getTools() {
        return List.of(
            Tool.of("echo", "Returns the parameters it was called with"),
            new Tool("add", "Adds two numbers", addSchema()));
    }

    @Override
    public JsonNode executeTool(String name, JsonNode parameters) throws McpException {
        LOGGER.debug("Executing tool {} with {}", name, parameters);
        return switch (name) {
            case "echo" -> parameters;
            case "add" -> add(parameters);
            default -> throw McpException.notFound("Tool " + name);
        };
    }

    private JsonNode add(JsonNode parameters) throws McpException {
        JsonNode a = parameters.path("a");
        JsonNode b = parameters.path("b");
        if (!a.isNumber() || !b.isNumber()) {
            throw McpException.invalidRequest("add requires numeric parameters 'a' and 'b'");
        }
        return objectMapper.createObjectNode().put("sum", a.decimalValue().add(b.decimalValue()));
    }

    private ObjectNode addSchema() {
        ObjectNode schema = objectMapper.createObjectNode().put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        properties.putObject("a").put("type", "number");
        properties.putObject("b").put("type", "number");
        schema.putArray("required").add("a").add("b");
        return schema;
    }
}
