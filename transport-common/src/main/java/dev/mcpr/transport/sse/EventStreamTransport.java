package dev.mcpr.transport.sse;

import dev.mcpr.error.McpException;
import dev.mcpr.transport.ConnectionState;
import dev.mcpr.transport.Inbox;
import dev.mcpr.transport.Transport;
import java.net.URI;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Half-duplex transport over HTTP using server-sent events for one direction and discrete
 * POST exchanges for the other. Inbound documents are both queued for {@link #receiveText()}
 * and handed to the message callback.
 */
public abstract class EventStreamTransport implements Transport {

    static final String EVENTS_PATH = "/events";
    static final String MESSAGE_PATH = "/message";
    static final String CLIENT_ID_PARAM = "clientId";
    static final String ENDPOINT_EVENT = "endpoint";

    protected final ConnectionState connection;
    protected final Inbox inbox = new Inbox();

    private volatile Duration receiveTimeout;

    protected EventStreamTransport(String name) {
        this.connection = new ConnectionState(name);
    }

    /**
     * Client side: subscribes to {@code <baseUri>/events} and posts to the endpoint the server announces.
     */
    public static EventStreamClientTransport client(URI baseUri) {
        return new EventStreamClientTransport(baseUri);
    }

    /**
     * Server side: serves {@code /events} and {@code /message} on the given address. Port 0 picks a free port.
     */
    public static EventStreamServerTransport server(String host, int port) {
        return new EventStreamServerTransport(host, port);
    }

    /**
     * Bound the wait of {@link #receiveText()}; {@code null} waits for as long as the transport is connected.
     */
    protected void setReceiveTimeout(Duration timeout) {
        this.receiveTimeout = timeout;
    }

    @Override
    public String receiveText() throws McpException {
        return inbox.take(connection::isConnected, receiveTimeout);
    }

    @Override
    public boolean isConnected() {
        return connection.isConnected();
    }

    @Override
    public void setOnMessage(Consumer<String> callback) {
        connection.setOnMessage(callback);
    }

    @Override
    public void setOnError(Consumer<McpException> callback) {
        connection.setOnError(callback);
    }

    @Override
    public void setOnClose(Runnable callback) {
        connection.setOnClose(callback);
    }
}
