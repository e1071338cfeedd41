package dev.mcpr.transport;

import dev.mcpr.error.McpException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous newline delimited transport over a duplex byte stream: the process standard
 * streams, an arbitrary stream pair, or the stdio of a child process. There is no background
 * thread; {@link #receiveText()} blocks the caller on a single line read. The message callback
 * fires on every successful send and receive and acts as a trace hook.
 */
public class StreamTransport implements Transport {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamTransport.class);

    private final ConnectionState connection;
    private final List<String> command;
    private final Object writeLock = new Object();

    private InputStream in;
    private OutputStream out;
    private LineCodec.LineReader reader;
    private Process process;

    public StreamTransport(InputStream in, OutputStream out) {
        this.connection = new ConnectionState("stdio");
        this.command = null;
        this.in = in;
        this.out = out;
    }

    private StreamTransport(List<String> command) {
        this.connection = new ConnectionState("stdio:" + command.get(0));
        this.command = List.copyOf(command);
    }

    /**
     * Transport over {@code System.in} and {@code System.out}.
     */
    public static StreamTransport stdio() {
        return new StreamTransport(System.in, System.out);
    }

    /**
     * Transport over the stdio pair of a child process launched by {@link #start()}.
     */
    public static StreamTransport forProcess(List<String> command) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        return new StreamTransport(command);
    }

    @Override
    public void start() throws McpException {
        connection.checkStartable();
        if (command != null) {
            try {
                process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
            } catch (IOException e) {
                throw McpException.transport("Failed to launch " + command + ": " + e.getMessage(), e);
            }
            in = process.getInputStream();
            out = process.getOutputStream();
            LOGGER.info("Launched child process {} (pid {})", command, process.pid());
        }
        reader = new LineCodec.LineReader(in);
        connection.markConnected();
        LOGGER.debug("Stream transport {} started", connection.name());
    }

    @Override
    public void close() {
        if (!connection.markClosed()) {
            return;
        }
        LOGGER.info("Closing stream transport {}", connection.name());
        if (process != null) {
            try {
                out.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing child stdin", e);
            }
            process.destroy();
        }
        connection.fireClose();
    }

    @Override
    public void sendText(String text) throws McpException {
        connection.requireConnected();
        try {
            synchronized (writeLock) {
                LineCodec.writeLine(out, text);
            }
        } catch (IOException e) {
            McpException error = McpException.transport("Failed to write: " + e.getMessage(), e);
            connection.fireError(error);
            throw error;
        }
        Wire.tx(connection.name(), text);
        connection.fireMessage(text);
    }

    @Override
    public String receiveText() throws McpException {
        connection.requireConnected();
        String line;
        try {
            line = reader.readLine();
        } catch (IOException e) {
            McpException error = McpException.transport("Failed to read: " + e.getMessage(), e);
            connection.fireError(error);
            throw error;
        }
        if (line == null) {
            McpException error = McpException.transport("End of stream reached");
            connection.fireError(error);
            throw error;
        }
        Wire.rx(connection.name(), line);
        connection.fireMessage(line);
        return line;
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
