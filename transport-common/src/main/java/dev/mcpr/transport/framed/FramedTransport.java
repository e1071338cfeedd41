package dev.mcpr.transport.framed;

import dev.mcpr.error.McpException;
import dev.mcpr.transport.ConnectionState;
import dev.mcpr.transport.Transport;
import dev.mcpr.transport.Wire;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport over a persistent framed connection such as a WebSocket. Delivery is push only:
 * a background reader hands every text frame to the message callback. Binary frames are dropped,
 * ping and pong are absorbed and a close frame closes the transport. A read that would block is
 * retried; every other read failure is fatal and tears the connection down.
 * Wrap in {@link dev.mcpr.transport.QueueingTransport} to pull messages.
 */
public class FramedTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(FramedTransport.class);

    static final Duration POLL_INTERVAL = Duration.ofMillis(10);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

    private final URI uri;
    private final FrameConnector connector;
    private final ConnectionState connection;
    private final Object writeLock = new Object();

    private volatile FrameChannel channel;
    private Thread readerThread;

    public FramedTransport(URI uri) {
        this(uri, new SpringWebSocketConnector());
    }

    public FramedTransport(URI uri, FrameConnector connector) {
        this.uri = uri;
        this.connector = connector;
        this.connection = new ConnectionState("ws:" + uri);
        LOGGER.info("Creating new WebSocket transport with URL: {}", uri);
    }

    @Override
    public void start() throws McpException {
        connection.checkStartable();
        LOGGER.info("Starting WebSocket transport with URL: {}", uri);
        try {
            channel = connector.connect(uri);
        } catch (IOException e) {
            throw McpException.transport("Failed to connect to WebSocket: " + e.getMessage(), e);
        }
        connection.markConnected();
        readerThread = new Thread(this::readLoop, "websocket-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        LOGGER.info("Successfully connected to WebSocket server");
    }

    private void readLoop() {
        LOGGER.debug("WebSocket receiver thread started");
        while (connection.isConnected()) {
            Frame frame;
            try {
                frame = channel.read();
            } catch (IOException e) {
                if (!connection.isConnected()) {
                    break;
                }
                if (isWouldBlock(e)) {
                    sleepQuietly();
                    continue;
                }
                McpException error = McpException.transport("WebSocket error: " + e.getMessage(), e);
                LOGGER.error("{}", error.getMessage());
                connection.fireError(error);
                teardown();
                break;
            }
            switch (frame.type()) {
                case TEXT -> {
                    Wire.rx(connection.name(), frame.text());
                    connection.fireMessage(frame.text());
                }
                case BINARY -> LOGGER.debug("Dropping binary frame of {} bytes", frame.payload().length);
                case PING, PONG -> LOGGER.trace("Absorbed {} frame", frame.type());
                case CLOSE -> {
                    LOGGER.info("WebSocket closed by server with status {} {}", frame.closeCode(), frame.text());
                    teardown();
                }
            }
        }
        LOGGER.debug("WebSocket receiver thread exited");
    }

    /**
     * A timed read that found nothing is the only non-fatal read failure.
     */
    static boolean isWouldBlock(IOException e) {
        return e instanceof SocketTimeoutException;
    }

    private void teardown() {
        if (connection.markClosed()) {
            closeChannel();
            connection.fireClose();
        }
    }

    @Override
    public void close() {
        boolean transitioned = connection.markClosed();
        Thread thread = readerThread;
        if (!transitioned && thread == null) {
            return;
        }
        LOGGER.info("Closing WebSocket transport");
        readerThread = null;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeChannel();
        connection.fireClose();
    }

    @Override
    public void sendText(String text) throws McpException {
        connection.requireConnected();
        try {
            synchronized (writeLock) {
                channel.sendText(text);
            }
        } catch (IOException e) {
            McpException error = McpException.transport("Failed to send WebSocket message: " + e.getMessage(), e);
            connection.fireError(error);
            throw error;
        }
        Wire.tx(connection.name(), text);
    }

    @Override
    public String receiveText() throws McpException {
        throw McpException.transport(
            "WebSocket transport delivers messages through the message callback only; receiveText is not supported");
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

    private void closeChannel() {
        FrameChannel current = channel;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close WebSocket channel", e);
        }
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(POLL_INTERVAL.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
