package dev.mcpr.transport;

import dev.mcpr.error.McpException;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Guarded state cell holding the connection state and the callback triple of one transport.
 * Owned by the transport and shared only with its background reader. Callbacks are invoked
 * outside the lock.
 */
public final class ConnectionState {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionState.class);

    private final Object lock = new Object();
    private final String name;

    private TransportState state = TransportState.IDLE;
    private Consumer<String> onMessage;
    private Consumer<McpException> onError;
    private Runnable onClose;
    private boolean closeNotified;

    public ConnectionState(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public TransportState state() {
        synchronized (lock) {
            return state;
        }
    }

    public boolean isConnected() {
        synchronized (lock) {
            return state == TransportState.CONNECTED;
        }
    }

    /**
     * Verify that {@code start()} may proceed.
     */
    public void checkStartable() throws McpException {
        synchronized (lock) {
            switch (state) {
                case CONNECTED -> throw McpException.alreadyConnected();
                case CLOSED -> throw McpException.state("Transport " + name + " is closed and cannot be restarted");
                default -> {
                }
            }
        }
    }

    public void markConnected() {
        synchronized (lock) {
            state = TransportState.CONNECTED;
        }
    }

    /**
     * Flip a connected transport to closed.
     * @return {@code true} when this call performed the transition
     */
    public boolean markClosed() {
        synchronized (lock) {
            if (state != TransportState.CONNECTED) {
                return false;
            }
            state = TransportState.CLOSED;
            return true;
        }
    }

    public void requireConnected() throws McpException {
        if (!isConnected()) {
            McpException error = McpException.notConnected();
            fireError(error);
            throw error;
        }
    }

    public void setOnMessage(Consumer<String> callback) {
        synchronized (lock) {
            onMessage = callback;
        }
    }

    public void setOnError(Consumer<McpException> callback) {
        synchronized (lock) {
            onError = callback;
        }
    }

    public void setOnClose(Runnable callback) {
        synchronized (lock) {
            onClose = callback;
        }
    }

    public void fireMessage(String message) {
        Consumer<String> callback;
        synchronized (lock) {
            callback = onMessage;
        }
        if (callback != null) {
            try {
                callback.accept(message);
            } catch (RuntimeException e) {
                LOGGER.warn("Message callback of {} failed", name, e);
            }
        }
    }

    public void fireError(McpException error) {
        Consumer<McpException> callback;
        synchronized (lock) {
            callback = onError;
        }
        if (callback != null) {
            try {
                callback.accept(error);
            } catch (RuntimeException e) {
                LOGGER.warn("Error callback of {} failed", name, e);
            }
        }
    }

    /**
     * Invoke the close callback unless it already ran.
     */
    public void fireClose() {
        Runnable callback;
        synchronized (lock) {
            if (closeNotified || state != TransportState.CLOSED) {
                return;
            }
            closeNotified = true;
            callback = onClose;
        }
        if (callback != null) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LOGGER.warn("Close callback of {} failed", name, e);
            }
        }
    }
}
