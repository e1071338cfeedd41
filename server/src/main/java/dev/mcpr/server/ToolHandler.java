package dev.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mcpr.error.McpException;

/**
 * Executes one declared tool.
 */
@FunctionalInterface
public interface ToolHandler {

    /**
     * @param parameters tool parameters as sent by the client, {@code NullNode} when absent
     * @return the tool result
     * @throws McpException reported to the client as a tool execution failure
     */
    JsonNode handle(JsonNode parameters) throws McpException;
}
