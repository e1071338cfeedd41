package dev.mcpr.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Descriptor of a prompt template.
 * @param name unique prompt name
 * @param description optional description
 * @param arguments arguments accepted by the template
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Prompt(String name, String description, List<PromptArgument> arguments) {

    public Prompt {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }
}
