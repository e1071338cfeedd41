package dev.mcpr.transport;

import dev.mcpr.error.McpException;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Newline delimited transport over TCP, in client or listener mode.
 * <p>
 * A single background thread reads lines and hands each one to the message callback and to the
 * inbox served by {@link #receiveText()}. In listener mode the same thread accepts peers, one active
 * peer at a time; a peer hanging up only clears the active peer. In client mode a peer hang-up
 * closes the transport. The thread polls the connection flag every {@link #POLL_INTERVAL}.
 */
public class SocketTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(SocketTransport.class);

    public static final Duration POLL_INTERVAL = Duration.ofMillis(10);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

    private enum Mode {
        CLIENT, LISTENER
    }

    private final Mode mode;
    private final String host;
    private final int port;
    private final ConnectionState connection;
    private final Inbox inbox = new Inbox();
    private final Object peerLock = new Object();
    private final Object writeLock = new Object();

    private volatile Duration receiveTimeout;
    private ServerSocket serverSocket;
    private Socket peer;
    private OutputStream peerOut;
    private Thread readerThread;

    private SocketTransport(Mode mode, String host, int port) {
        this.mode = mode;
        this.host = host;
        this.port = port;
        this.connection = new ConnectionState("tcp:" + host + ":" + port);
    }

    /**
     * Client transport dialing {@code host:port} on {@link #start()}.
     */
    public static SocketTransport connect(String host, int port) {
        LOGGER.info("Creating TCP transport client for address: {}:{}", host, port);
        return new SocketTransport(Mode.CLIENT, host, port);
    }

    /**
     * Listener transport binding {@code host:port} on {@link #start()}. Port 0 picks a free port.
     */
    public static SocketTransport bind(String host, int port) {
        LOGGER.info("Creating TCP transport server on address: {}:{}", host, port);
        return new SocketTransport(Mode.LISTENER, host, port);
    }

    /**
     * Bound how long {@link #receiveText()} waits; {@code null} waits while connected.
     */
    public SocketTransport receiveTimeout(Duration timeout) {
        this.receiveTimeout = timeout;
        return this;
    }

    /**
     * @return the bound port in listener mode, the remote port in client mode
     */
    public int localPort() {
        if (serverSocket != null) {
            return serverSocket.getLocalPort();
        }
        return port;
    }

    /**
     * @return whether a peer is currently attached
     */
    public boolean hasPeer() {
        synchronized (peerLock) {
            return peerOut != null;
        }
    }

    @Override
    public void start() throws McpException {
        connection.checkStartable();
        if (mode == Mode.CLIENT) {
            startClient();
        } else {
            startListener();
        }
    }

    private void startClient() throws McpException {
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) CONNECT_TIMEOUT.toMillis());
            socket.setTcpNoDelay(true);
            socket.setSoTimeout((int) POLL_INTERVAL.toMillis());
            attachPeer(socket);
        } catch (IOException e) {
            closeQuietly(socket);
            throw McpException.transport("Failed to connect to " + host + ":" + port + ": " + e.getMessage(), e);
        }
        connection.markConnected();
        readerThread = new Thread(() -> clientLoop(socket), "tcp-client-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        LOGGER.info("Connected to {}:{}", host, port);
    }

    private void startListener() throws McpException {
        try {
            ServerSocket socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(new InetSocketAddress(host, port));
            socket.setSoTimeout((int) POLL_INTERVAL.toMillis());
            serverSocket = socket;
        } catch (IOException e) {
            throw McpException.transport("Failed to bind " + host + ":" + port + ": " + e.getMessage(), e);
        }
        connection.markConnected();
        readerThread = new Thread(this::acceptLoop, "tcp-server-accept");
        readerThread.setDaemon(true);
        readerThread.start();
        LOGGER.info("TCP server listening on {}:{}", host, serverSocket.getLocalPort());
    }

    private void clientLoop(Socket socket) {
        LOGGER.debug("TCP receiver thread started");
        boolean open = readLines(socket);
        if (!open && connection.markClosed()) {
            closeQuietly(socket);
            detachPeer(socket);
            connection.fireClose();
        }
        LOGGER.debug("TCP receiver thread exited");
    }

    private void acceptLoop() {
        LOGGER.debug("TCP server accepting thread started");
        while (connection.isConnected()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                if (connection.isConnected()) {
                    reportError(McpException.transport("Error accepting TCP connection: " + e.getMessage(), e));
                    sleepQuietly(POLL_INTERVAL);
                }
                continue;
            }
            try {
                socket.setTcpNoDelay(true);
                socket.setSoTimeout((int) POLL_INTERVAL.toMillis());
                attachPeer(socket);
            } catch (IOException e) {
                reportError(McpException.transport("Failed to attach peer: " + e.getMessage(), e));
                closeQuietly(socket);
                continue;
            }
            LOGGER.info("TCP connection accepted from {}", socket.getRemoteSocketAddress());
            readLines(socket);
            detachPeer(socket);
            closeQuietly(socket);
        }
        LOGGER.debug("TCP server thread exited");
    }

    /**
     * Read lines until the transport closes or the peer goes away.
     * @return {@code true} when the loop ended because the transport was closed locally
     */
    private boolean readLines(Socket socket) {
        LineCodec.LineReader reader;
        try {
            reader = new LineCodec.LineReader(new BufferedInputStream(socket.getInputStream()));
        } catch (IOException e) {
            reportError(McpException.transport("Failed to open TCP input: " + e.getMessage(), e));
            return false;
        }
        while (connection.isConnected()) {
            String line;
            try {
                line = reader.readLine();
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                if (!connection.isConnected()) {
                    return true;
                }
                reportError(McpException.transport("Error reading from TCP stream: " + e.getMessage(), e));
                return false;
            }
            if (line == null) {
                LOGGER.info("TCP connection closed by peer {}", socket.getRemoteSocketAddress());
                return false;
            }
            if (line.isBlank()) {
                continue;
            }
            Wire.rx(connection.name(), line);
            inbox.offer(line);
            connection.fireMessage(line);
        }
        return true;
    }

    @Override
    public void close() {
        boolean transitioned = connection.markClosed();
        Thread thread = readerThread;
        if (!transitioned && thread == null) {
            return;
        }
        LOGGER.info("Closing TCP transport for address: {}:{}", host, port);
        readerThread = null;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        synchronized (peerLock) {
            closeQuietly(peer);
            peer = null;
            peerOut = null;
        }
        closeQuietly(serverSocket);
        connection.fireClose();
        LOGGER.info("TCP transport closed");
    }

    @Override
    public void sendText(String text) throws McpException {
        connection.requireConnected();
        OutputStream out;
        synchronized (peerLock) {
            out = peerOut;
        }
        if (out == null) {
            McpException error = McpException.notConnected();
            connection.fireError(error);
            throw error;
        }
        try {
            synchronized (writeLock) {
                LineCodec.writeLine(out, text);
            }
        } catch (IOException e) {
            McpException error = McpException.transport("Failed to send TCP message: " + e.getMessage(), e);
            reportError(error);
            throw error;
        }
        Wire.tx(connection.name(), text);
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

    private void attachPeer(Socket socket) throws IOException {
        OutputStream out = new BufferedOutputStream(socket.getOutputStream());
        synchronized (peerLock) {
            peer = socket;
            peerOut = out;
        }
    }

    private void detachPeer(Socket socket) {
        synchronized (peerLock) {
            if (peer == socket) {
                peer = null;
                peerOut = null;
            }
        }
    }

    private void reportError(McpException error) {
        LOGGER.error("TCP transport error: {}", error.getMessage());
        connection.fireError(error);
    }

    private static void sleepQuietly(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Closeable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing {}", closeable, e);
        }
    }
}
