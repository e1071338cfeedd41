package dev.mcpr.error;

/**
 * The closed set of failure kinds raised by transports, the codec and both engines.
 * Each kind knows whether it requires the current connection to be torn down.
 */
public enum ErrorKind {

    TRANSPORT("Transport error", true),
    SERIALIZATION("Serialization error", false),
    DESERIALIZATION("Deserialization error", false),
    PROTOCOL("Protocol error", true),
    NOT_FOUND("Not found", false),
    INVALID_REQUEST("Invalid request", false),
    AUTHENTICATION("Authentication error", true),
    AUTHORIZATION("Authorization error", true),
    STATE("State error", false),
    TRANSITION("Transition error", false),
    ALREADY_CONNECTED("Transport error", false),
    NOT_CONNECTED("Transport error", true),
    TIMEOUT("Transport error", false),
    INTERNAL("Internal error", false);

    private final String label;
    private final boolean fatal;

    ErrorKind(String label, boolean fatal) {
        this.label = label;
        this.fatal = fatal;
    }

    /**
     * Prefix used when rendering an error of this kind.
     * @return human readable label
     */
    public String label() {
        return label;
    }

    /**
     * Whether an error of this kind requires the connection to be terminated.
     * @return {@code true} for transport, protocol, not-connected and auth failures
     */
    public boolean isFatal() {
        return fatal;
    }
}
