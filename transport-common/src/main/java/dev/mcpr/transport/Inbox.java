package dev.mcpr.transport;

import dev.mcpr.error.McpException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Queue of inbound documents filled by a background reader and drained by {@code receiveText()}.
 */
public final class Inbox {

    private static final long POLL_MILLIS = 50;

    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();

    public void offer(String message) {
        queue.offer(message);
    }

    public int size() {
        return queue.size();
    }

    public void clear() {
        queue.clear();
    }

    /**
     * Take the next document. Queued documents are still handed out after the connection dropped.
     * @param connected whether the connection the documents arrive on is still up
     * @param timeout maximum wait, {@code null} to wait as long as the connection is up
     */
    public String take(BooleanSupplier connected, Duration timeout) throws McpException {
        long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                String message = queue.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    return message;
                }
                if (!connected.getAsBoolean()) {
                    throw McpException.notConnected();
                }
                if (System.nanoTime() - deadline >= 0) {
                    throw McpException.timeout();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw McpException.transport("Interrupted while waiting for a message", e);
        }
    }
}
