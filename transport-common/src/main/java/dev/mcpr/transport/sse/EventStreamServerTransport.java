package dev.mcpr.transport.sse;

import dev.mcpr.error.McpException;
import dev.mcpr.transport.Wire;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.LifecycleState;
import org.apache.catalina.Wrapper;
import org.apache.catalina.connector.Connector;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.FileSystemUtils;

/**
 * Server side of the event-stream transport, served by an embedded Tomcat. Every subscriber of
 * {@code /events} gets an opaque client id and a private outbound queue. The peer that posted
 * last becomes the current client, and {@link #sendText(String)} enqueues onto its queue.
 */
public class EventStreamServerTransport extends EventStreamTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamServerTransport.class);

    static final Duration DEFAULT_DRAIN_DELAY = Duration.ofMillis(500);
    static final Duration KEEP_ALIVE_INTERVAL = Duration.ofSeconds(15);

    private final String host;
    private final int port;
    private final Map<String, ClientSession> sessions = new ConcurrentHashMap<>();

    private volatile String currentClientId;
    private volatile Duration drainDelay = DEFAULT_DRAIN_DELAY;
    private volatile Duration keepAliveInterval = KEEP_ALIVE_INTERVAL;
    private Tomcat tomcat;
    private volatile Path baseDir;

    EventStreamServerTransport(String host, int port) {
        super("sse-server:" + host + ":" + port);
        this.host = host;
        this.port = port;
    }

    public EventStreamServerTransport receiveTimeout(Duration timeout) {
        setReceiveTimeout(timeout);
        return this;
    }

    /**
     * How long {@link #close()} waits for queued responses to be picked up before stopping the listener.
     */
    public EventStreamServerTransport drainDelay(Duration delay) {
        this.drainDelay = delay;
        return this;
    }

    public EventStreamServerTransport keepAliveInterval(Duration interval) {
        this.keepAliveInterval = interval;
        return this;
    }

    /**
     * Actual listening port, or -1 before {@link #start()}.
     */
    public int localPort() {
        Tomcat server = tomcat;
        return server == null ? -1 : server.getConnector().getLocalPort();
    }

    public String currentClientId() {
        return currentClientId;
    }

    public void setCurrentClientId(String clientId) {
        this.currentClientId = clientId;
    }

    public int subscriberCount() {
        return sessions.size();
    }

    @Override
    public void start() throws McpException {
        connection.checkStartable();
        LOGGER.info("Starting SSE server on {}:{}", host, port);
        Tomcat server = new Tomcat();
        Path baseDir = null;
        try {
            baseDir = Files.createTempDirectory("mcpr-sse");
            server.setBaseDir(baseDir.toString());
            server.setHostname(host);
            server.setPort(port);
            Connector connector = server.getConnector();
            connector.setProperty("address", host);

            Context context = server.addContext("", baseDir.toString());
            Wrapper wrapper = Tomcat.addServlet(context, "mcpEventStream", new EventStreamServlet(this));
            wrapper.setAsyncSupported(true);
            context.addServletMappingDecoded(EVENTS_PATH, "mcpEventStream");
            context.addServletMappingDecoded(MESSAGE_PATH, "mcpEventStream");

            connection.markConnected();
            server.start();
            if (connector.getState() != LifecycleState.STARTED) {
                throw new LifecycleException("connector is " + connector.getState());
            }
        } catch (IOException | LifecycleException e) {
            connection.markClosed();
            destroy(server, baseDir);
            throw McpException.transport("Failed to start SSE server on " + host + ":" + port + ": " + e.getMessage(), e);
        }
        tomcat = server;
        this.baseDir = baseDir;
        LOGGER.info("SSE server listening on {}:{}", host, localPort());
    }

    @Override
    public void sendText(String text) throws McpException {
        connection.requireConnected();
        String clientId = currentClientId;
        if (clientId == null) {
            McpException error = McpException.transport("No client id set for SSE server response");
            connection.fireError(error);
            throw error;
        }
        ClientSession session = sessions.get(clientId);
        if (session == null) {
            McpException error = McpException.transport("SSE client " + clientId + " is no longer connected");
            connection.fireError(error);
            throw error;
        }
        session.outbound().offer(text);
        Wire.tx(connection.name(), text);
    }

    @Override
    public void close() {
        if (!connection.markClosed()) {
            return;
        }
        LOGGER.info("Closing SSE server, draining for {} ms", drainDelay.toMillis());
        try {
            Thread.sleep(drainDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Tomcat server = tomcat;
        tomcat = null;
        destroy(server, baseDir);
        sessions.clear();
        connection.fireClose();
    }

    ClientSession register() {
        ClientSession session = new ClientSession(UUID.randomUUID().toString(), new LinkedBlockingQueue<>());
        sessions.put(session.id(), session);
        LOGGER.info("SSE client {} subscribed", session.id());
        return session;
    }

    void unregister(ClientSession session) {
        sessions.remove(session.id());
        LOGGER.info("SSE client {} unsubscribed", session.id());
    }

    boolean isKnown(String clientId) {
        return sessions.containsKey(clientId);
    }

    /**
     * Hand an inbound POST body to the engine side.
     */
    void deliver(String clientId, String text) {
        currentClientId = clientId;
        Wire.rx(connection.name(), text);
        inbox.offer(text);
        connection.fireMessage(text);
    }

    Duration keepAlive() {
        return keepAliveInterval;
    }

    /**
     * Tomcat working directory of the running listener, {@code null} before {@link #start()}.
     */
    Path baseDir() {
        return baseDir;
    }

    private static void destroy(Tomcat server, Path baseDir) {
        if (server != null) {
            try {
                server.stop();
                server.destroy();
            } catch (LifecycleException e) {
                LOGGER.warn("Failed to stop embedded Tomcat", e);
            }
        }
        if (baseDir != null) {
            try {
                FileSystemUtils.deleteRecursively(baseDir);
            } catch (IOException e) {
                LOGGER.warn("Failed to delete Tomcat base directory {}", baseDir, e);
            }
        }
    }

    record ClientSession(String id, BlockingQueue<String> outbound) {
    }
}
