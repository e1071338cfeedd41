package dev.mcpr.transport;

import dev.mcpr.error.McpException;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Gives a push-only transport a pull side: every payload the delegate hands to its message callback
 * is queued and served from {@link #receiveText()}. A callback registered here still sees every payload.
 */
public class QueueingTransport implements Transport {

    private final Transport delegate;
    private final Inbox inbox = new Inbox();
    private final Duration receiveTimeout;

    private volatile Consumer<String> onMessage;

    public QueueingTransport(Transport delegate) {
        this(delegate, null);
    }

    public QueueingTransport(Transport delegate, Duration receiveTimeout) {
        this.delegate = delegate;
        this.receiveTimeout = receiveTimeout;
        delegate.setOnMessage(this::enqueue);
    }

    private void enqueue(String message) {
        inbox.offer(message);
        Consumer<String> callback = onMessage;
        if (callback != null) {
            callback.accept(message);
        }
    }

    @Override
    public void start() throws McpException {
        delegate.start();
    }

    @Override
    public void close() {
        delegate.close();
    }

    @Override
    public void sendText(String text) throws McpException {
        delegate.sendText(text);
    }

    @Override
    public String receiveText() throws McpException {
        return inbox.take(delegate::isConnected, receiveTimeout);
    }

    @Override
    public boolean isConnected() {
        return delegate.isConnected();
    }

    @Override
    public void setOnMessage(Consumer<String> callback) {
        this.onMessage = callback;
    }

    @Override
    public void setOnError(Consumer<McpException> callback) {
        delegate.setOnError(callback);
    }

    @Override
    public void setOnClose(Runnable callback) {
        delegate.setOnClose(callback);
    }
}
