package dev.mcpr.schema;

/**
 * A single rendered prompt message.
 * @param role {@code user}, {@code assistant} or {@code system}
 * @param content message text
 */
public record PromptMessage(String role, String content) {
}
