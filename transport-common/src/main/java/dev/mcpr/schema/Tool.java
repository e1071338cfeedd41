package dev.mcpr.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Descriptor of a tool the server can execute.
 * @param name unique tool name
 * @param description optional human readable description
 * @param inputSchema JSON schema of the tool parameters
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Tool(String name, String description, JsonNode inputSchema) {

    /**
     * Create a descriptor accepting an arbitrary object as input.
     */
    public static Tool of(String name, String description) {
        ObjectNode schema = JsonNodeFactory.instance.objectNode();
        schema.put("type", "object");
        return new Tool(name, description, schema);
    }
}
