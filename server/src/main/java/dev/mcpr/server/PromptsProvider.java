package dev.mcpr.server;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.Prompt;
import dev.mcpr.schema.PromptMessage;
import java.util.List;

public interface PromptsProvider {

    List<Prompt> getPrompts();

    /**
     * Render a prompt.
     * @param arguments argument values keyed by name, {@code NullNode} when absent
     */
    List<PromptMessage> getPromptMessages(String name, JsonNode arguments) throws McpException;
}
