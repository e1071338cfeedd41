package dev.mcpr.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Descriptor of a resource exposed by the server.
 * @param uri resource URI
 * @param name short name
 * @param description optional description
 * @param mimeType optional MIME type of the contents
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Resource(String uri, String name, String description, String mimeType) {
}
