package dev.mcpr.server.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import dev.mcpr.error.McpException;
import dev.mcpr.schema.Prompt;
import dev.mcpr.schema.PromptArgument;
import dev.mcpr.schema.PromptMessage;
import dev.mcpr.server.PromptsProvider;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class GreetingPromptsProvider implements PromptsProvider {

    private static final List<Prompt> PROMPTS = List.of(
        new Prompt("system_prompt", "System instructions with caller supplied context",
            List.of(new PromptArgument("context", "Context for the assistant", true))),
        new Prompt("user_greeting", "Greets a user, optionally formally",
            List.of(new PromptArgument("name", "Name of the user", true),
                new PromptArgument("formal", "Use a formal greeting", false))));

    @Override
    public List<Prompt> getPrompts() {
        return PROMPTS;
    }

    @Override
    public List<PromptMessage> getPromptMessages(String name, JsonNode arguments) throws McpException {
        return switch (name) {
            case "system_prompt" -> List.of(new PromptMessage("system",
                "You are a helpful assistant with the following context: " + required(arguments, "context")));
            case "user_greeting" -> {
                String user = required(arguments, "name");
                boolean formal = arguments.path("formal").asBoolean(false);
                yield List.of(new PromptMessage("user", formal ? "Good day, " + user + "." : "Hey " + user + "!"));
            }
            default -> throw McpException.notFound("Prompt " + name);
        };
    }

    private static String required(JsonNode arguments, String name) throws McpException {
        JsonNode value = arguments.path(name);
        if (!value.isTextual()) {
            throw McpException.invalidRequest("Missing prompt argument '" + name + "'");
        }
        return value.textValue();
    }
}
