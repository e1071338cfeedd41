package dev.mcpr.transport.sse;

import dev.mcpr.error.McpException;
import dev.mcpr.transport.Wire;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the event-stream transport. A background reader keeps a GET subscription on
 * {@code /events} open and reconnects after a pause when the server ends the stream. Outbound
 * documents are POSTed synchronously to the endpoint announced by the server's {@code endpoint} event.
 */
public class EventStreamClientTransport extends EventStreamTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamClientTransport.class);

    static final Duration ENDPOINT_TIMEOUT = Duration.ofSeconds(10);
    static final Duration RECONNECT_DELAY = Duration.ofSeconds(2);
    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

    private final URI baseUri;
    private final HttpClient httpClient;

    private final CompletableFuture<URI> endpointReady = new CompletableFuture<>();
    private volatile URI messageEndpoint;
    private volatile InputStream eventStream;
    private Thread readerThread;

    EventStreamClientTransport(URI baseUri) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    public EventStreamClientTransport(URI baseUri, HttpClient httpClient) {
        super("sse:" + baseUri);
        this.baseUri = baseUri;
        this.httpClient = httpClient;
    }

    public EventStreamClientTransport receiveTimeout(Duration timeout) {
        setReceiveTimeout(timeout);
        return this;
    }

    /**
     * Endpoint that outbound documents are POSTed to, once announced.
     */
    public URI messageEndpoint() {
        return messageEndpoint;
    }

    @Override
    public void start() throws McpException {
        connection.checkStartable();
        LOGGER.info("Starting SSE transport with URI: {}", baseUri);
        connection.markConnected();
        readerThread = new Thread(this::readLoop, "sse-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        try {
            endpointReady.get(ENDPOINT_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            close();
            throw McpException.transport("Timed out waiting for the SSE endpoint event from " + baseUri, e);
        } catch (ExecutionException e) {
            close();
            throw McpException.transport("Failed to open SSE stream: " + e.getCause().getMessage(), e.getCause());
        } catch (CancellationException e) {
            throw McpException.transport("SSE transport closed while connecting");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw McpException.transport("Interrupted while opening SSE stream", e);
        }
        LOGGER.info("SSE transport connected, posting to {}", messageEndpoint);
    }

    private void readLoop() {
        URI eventsUri = baseUri.resolve(EVENTS_PATH);
        while (connection.isConnected()) {
            try {
                subscribe(eventsUri);
                if (connection.isConnected()) {
                    LOGGER.info("SSE stream ended, reconnecting in {} ms", RECONNECT_DELAY.toMillis());
                }
            } catch (IOException e) {
                if (!connection.isConnected()) {
                    break;
                }
                LOGGER.debug("Error connecting to SSE endpoint {}: {}", eventsUri, e.getMessage());
                if (!endpointReady.isDone()) {
                    endpointReady.completeExceptionally(e);
                }
                connection.fireError(McpException.transport("SSE stream error: " + e.getMessage(), e));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!connection.isConnected()) {
                break;
            }
            try {
                Thread.sleep(RECONNECT_DELAY.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOGGER.debug("SSE reader thread exited");
    }

    private void subscribe(URI eventsUri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(eventsUri)
            .header("Accept", "text/event-stream")
            .header("Cache-Control", "no-cache")
            .GET()
            .build();
        HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        if (response.statusCode() != 200) {
            response.body().close();
            throw new IOException("Unexpected HTTP status " + response.statusCode() + " from " + eventsUri);
        }
        eventStream = response.body();
        EventStreamParser parser = new EventStreamParser();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(eventStream, StandardCharsets.UTF_8))) {
            String line;
            while (connection.isConnected() && (line = reader.readLine()) != null) {
                EventStreamParser.Event event = parser.accept(line);
                if (event != null) {
                    onEvent(event);
                }
            }
        } finally {
            eventStream = null;
        }
    }

    private void onEvent(EventStreamParser.Event event) {
        if (ENDPOINT_EVENT.equals(event.type())) {
            messageEndpoint = baseUri.resolve(event.data().trim());
            LOGGER.debug("SSE endpoint discovered: {}", messageEndpoint);
            endpointReady.complete(messageEndpoint);
            return;
        }
        Wire.rx(connection.name(), event.data());
        inbox.offer(event.data());
        connection.fireMessage(event.data());
    }

    @Override
    public void sendText(String text) throws McpException {
        connection.requireConnected();
        URI endpoint = messageEndpoint;
        if (endpoint == null) {
            throw McpException.transport("SSE message endpoint has not been announced yet");
        }
        HttpRequest request = HttpRequest.newBuilder(endpoint)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(text, StandardCharsets.UTF_8))
            .build();
        HttpResponse<Void> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            McpException error = McpException.transport("Failed to send message: " + e.getMessage(), e);
            connection.fireError(error);
            throw error;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw McpException.transport("Interrupted while sending message", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            McpException error = McpException.transport("Failed to send message: HTTP status " + status);
            connection.fireError(error);
            throw error;
        }
        Wire.tx(connection.name(), text);
    }

    @Override
    public void close() {
        boolean transitioned = connection.markClosed();
        Thread thread = readerThread;
        if (!transitioned && thread == null) {
            return;
        }
        LOGGER.info("Closing SSE transport");
        readerThread = null;
        endpointReady.cancel(false);
        InputStream stream = eventStream;
        if (stream != null) {
            try {
                stream.close();
            } catch (IOException e) {
                LOGGER.debug("Failed to close SSE stream", e);
            }
        }
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        connection.fireClose();
    }
}
