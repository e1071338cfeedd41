package dev.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.Tool;
import java.util.List;

/**
 * Source of tools that are not individually registered on the server.
 */
public interface ToolsProvider {

    List<Tool> getTools();

    JsonNode executeTool(String name, JsonNode parameters) throws McpException;
}
