package dev.mcpr.transport;

import dev.mcpr.error.McpException;
import java.util.function.Consumer;

/**
 * Capability contract shared by every MCP transport.
 * <p>
 * State machine: {@code IDLE --start()--> CONNECTED --close()--> CLOSED}. Starting a connected
 * transport fails with {@code AlreadyConnected}; sending or receiving while idle or closed fails
 * with {@code NotConnected}. {@link #close()} is idempotent and fires the close callback at most
 * once over the lifetime of the transport.
 */
public interface Transport extends AutoCloseable {

    void start() throws McpException;

    /**
     * Close the transport. Never fails; problems releasing resources are logged.
     */
    @Override
    void close();

    void sendText(String text) throws McpException;

    /**
     * Block until the next inbound document is available.
     */
    String receiveText() throws McpException;

    boolean isConnected();

    /**
     * Replaces any previously registered message callback.
     */
    void setOnMessage(Consumer<String> callback);

    void setOnError(Consumer<McpException> callback);

    void setOnClose(Runnable callback);
}
