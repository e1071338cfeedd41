package dev.mcpr.server;

import static dev.mcpr.server.QueuedServerTransport.SHUTDOWN;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import dev.mcpr.error.ErrorKind;
import dev.mcpr.error.McpException;
import dev.mcpr.transport.SocketTransport;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class McpServerRetryTest {

    private static final String LIST = "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/list\"}";

    private static McpServer server() {
        return McpServer.builder().retryDelay(Duration.ofMillis(1)).build();
    }

    @Test
    void givesUpAfterMaxConsecutiveErrors() {
        QueuedServerTransport transport = new QueuedServerTransport()
            .fail(McpException.transport("Failed to read: boom"), 5)
            .then(SHUTDOWN);

        assertThatThrownBy(() -> server().start(transport))
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.detail()).isEqualTo("Failed to read: boom"));
        assertThat(transport.receives).isEqualTo(5);
    }

    @Test
    void survivesOneFewerThanMaxErrors() throws Exception {
        QueuedServerTransport transport = new QueuedServerTransport()
            .fail(McpException.transport("Failed to read: boom"), 4)
            .then(SHUTDOWN);

        server().start(transport);

        assertThat(transport.sent).containsExactly("{\"jsonrpc\":\"2.0\",\"id\":99,\"result\":{}}");
        assertThat(transport.closed).isTrue();
    }

    @Test
    void successfulMessageResetsTheCount() throws Exception {
        QueuedServerTransport transport = new QueuedServerTransport()
            .fail(McpException.timeout(), 4)
            .then(LIST)
            .fail(McpException.timeout(), 4)
            .then(SHUTDOWN);

        server().start(transport);

        assertThat(transport.sent).hasSize(2);
    }

    @Test
    void connectionSentinelsAreNotCounted() throws Exception {
        QueuedServerTransport transport = new QueuedServerTransport()
            .fail(McpException.notConnected(), 10)
            .fail(McpException.alreadyConnected(), 10)
            .then(SHUTDOWN);

        server().start(transport);

        assertThat(transport.receives).isEqualTo(21);
    }

    @Test
    void peerResetClearsTheCount() throws Exception {
        QueuedServerTransport transport = new QueuedServerTransport()
            .fail(McpException.internal("handler crashed"), 4)
            .fail(McpException.transport("Connection reset by peer"), 1)
            .fail(McpException.internal("handler crashed"), 4)
            .then(SHUTDOWN);

        assertThatCode(() -> server().start(transport)).doesNotThrowAnyException();
    }

    @Test
    void maxErrorsIsConfigurable() {
        QueuedServerTransport transport = new QueuedServerTransport()
            .fail(McpException.transport("End of stream reached"), 2)
            .then(SHUTDOWN);
        McpServer server = McpServer.builder().maxErrors(2).retryDelay(Duration.ofMillis(1)).build();

        assertThatThrownBy(() -> server.start(transport)).isInstanceOf(McpException.class);
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    void failedStartPropagates() throws Exception {
        QueuedServerTransport transport = new QueuedServerTransport();
        transport.start();

        assertThatThrownBy(() -> server().start(transport))
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.ALREADY_CONNECTED));
        assertThat(transport.receives).isZero();
    }

    @Test
    void classifiesTransientAndResetErrors() {
        assertThat(McpServer.isTransient(McpException.notConnected())).isTrue();
        assertThat(McpServer.isTransient(McpException.alreadyConnected())).isTrue();
        assertThat(McpServer.isTransient(McpException.timeout())).isFalse();
        assertThat(McpServer.isReset(McpException.transport("Connection RESET"))).isTrue();
        assertThat(McpServer.isReset(McpException.protocol("reset"))).isFalse();
    }

    @Test
    void stopFromAnotherThreadEndsTheLoop() throws Exception {
        McpServer server = server();
        SocketTransport transport = SocketTransport.bind("127.0.0.1", 0);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread loop = new Thread(() -> {
            try {
                server.start(transport);
            } catch (Throwable t) {
                failure.set(t);
            }
        }, "server-loop");
        loop.start();
        await().atMost(Duration.ofSeconds(5)).until(server::isRunning);

        server.stop();

        loop.join(5000);
        assertThat(loop.isAlive()).isFalse();
        assertThat(failure.get()).isNull();
        assertThat(transport.isConnected()).isFalse();
    }
}
