package dev.mcpr.transport.sse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import dev.mcpr.error.ErrorKind;
import dev.mcpr.error.McpException;
import java.net.URI;
import java.nio.file.Path;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventStreamTransportTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private EventStreamServerTransport server;
    private EventStreamClientTransport client;

    @BeforeEach
    void startServer() throws McpException {
        server = EventStreamTransport.server("127.0.0.1", 0)
            .drainDelay(Duration.ofMillis(50))
            .receiveTimeout(WAIT);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        server.close();
    }

    private URI baseUri() {
        return URI.create("http://127.0.0.1:" + server.localPort());
    }

    private void connectClient() throws McpException {
        client = EventStreamTransport.client(baseUri()).receiveTimeout(WAIT);
        client.start();
    }

    @Test
    void clientDiscoversEndpointOnStart() throws Exception {
        connectClient();

        assertThat(client.isConnected()).isTrue();
        assertThat(client.messageEndpoint().getPath()).isEqualTo("/message");
        assertThat(client.messageEndpoint().getQuery()).startsWith("clientId=");
        assertThat(server.subscriberCount()).isEqualTo(1);
    }

    @Test
    void secondStartIsAlreadyConnectedOnBothSides() throws Exception {
        connectClient();

        for (EventStreamTransport transport : List.of(server, client)) {
            for (int attempt = 0; attempt < 2; attempt++) {
                assertThatThrownBy(transport::start)
                    .isInstanceOfSatisfying(McpException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.ALREADY_CONNECTED));
            }
            assertThat(transport.isConnected()).isTrue();
        }
        assertThat(server.subscriberCount()).isEqualTo(1);
    }

    @Test
    void closeRemovesTomcatWorkingDirectory() {
        Path baseDir = server.baseDir();
        assertThat(baseDir).isDirectory();

        server.close();

        assertThat(baseDir).doesNotExist();
    }

    @Test
    void requestAndResponseRoundTrip() throws Exception {
        connectClient();

        client.sendText("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}");
        assertThat(server.receiveText()).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\"}");
        assertThat(server.currentClientId()).isNotNull();

        server.sendText("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");
        assertThat(client.receiveText()).isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");
    }

    @Test
    void inboundEventsReachClientCallback() throws Exception {
        connectClient();
        List<String> seen = new CopyOnWriteArrayList<>();
        client.setOnMessage(seen::add);
        client.sendText("{\"id\":1}");
        server.receiveText();

        server.sendText("{\"id\":1,\"result\":1}");

        await().atMost(WAIT).until(() -> seen.size() == 1);
        assertThat(seen).containsExactly("{\"id\":1,\"result\":1}");
    }

    @Test
    void serverSendWithoutCurrentClientFails() {
        assertThatThrownBy(() -> server.sendText("{}"))
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.TRANSPORT));
    }

    @Test
    void postValidation() throws Exception {
        HttpClient http = HttpClient.newHttpClient();

        HttpResponse<Void> unknown = http.send(HttpRequest.newBuilder(baseUri().resolve("/message?clientId=nobody"))
            .POST(HttpRequest.BodyPublishers.ofString("{}")).build(), HttpResponse.BodyHandlers.discarding());
        HttpResponse<Void> missing = http.send(HttpRequest.newBuilder(baseUri().resolve("/message"))
            .POST(HttpRequest.BodyPublishers.ofString("{}")).build(), HttpResponse.BodyHandlers.discarding());

        assertThat(unknown.statusCode()).isEqualTo(404);
        assertThat(missing.statusCode()).isEqualTo(400);

        connectClient();
        HttpResponse<Void> empty = http.send(HttpRequest.newBuilder(client.messageEndpoint())
            .POST(HttpRequest.BodyPublishers.ofString("  ")).build(), HttpResponse.BodyHandlers.discarding());
        assertThat(empty.statusCode()).isEqualTo(400);
    }

    @Test
    void queuedResponseIsDrainedOnClose() throws Exception {
        connectClient();
        client.sendText("{\"id\":5,\"method\":\"shutdown\"}");
        server.receiveText();

        server.sendText("{\"id\":5,\"result\":{}}");
        server.close();

        assertThat(client.receiveText()).isEqualTo("{\"id\":5,\"result\":{}}");
    }

    @Test
    void clientCloseNotifiesOnce() throws Exception {
        connectClient();
        AtomicInteger closes = new AtomicInteger();
        client.setOnClose(closes::incrementAndGet);

        client.close();
        client.close();

        assertThat(closes).hasValue(1);
        assertThat(client.isConnected()).isFalse();
        assertThatThrownBy(() -> client.sendText("{}"))
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_CONNECTED));
    }

    @Test
    void clientStartFailsWithoutServer() {
        server.close();
        client = new EventStreamClientTransport(URI.create("http://127.0.0.1:1"), HttpClient.newHttpClient());

        assertThatThrownBy(client::start)
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.TRANSPORT));
        assertThat(client.isConnected()).isFalse();
    }
}
