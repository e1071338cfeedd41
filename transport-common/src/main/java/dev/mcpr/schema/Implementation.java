package dev.mcpr.schema;

/**
 * Name and version of a client or server implementation.
 * @param name implementation name
 * @param version implementation version
 */
public record Implementation(String name, String version) {
}
