package dev.mcpr.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromptArgument(String name, String description, boolean required) {
}
