package dev.mcpr.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Text contents of a resource.
 * @param uri resource URI
 * @param mimeType optional MIME type
 * @param text resource body
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceContents(String uri, String mimeType, String text) {
}
