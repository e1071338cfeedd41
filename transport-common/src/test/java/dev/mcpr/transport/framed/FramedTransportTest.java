package dev.mcpr.transport.framed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import dev.mcpr.error.ErrorKind;
import dev.mcpr.error.McpException;
import dev.mcpr.transport.QueueingTransport;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class FramedTransportTest {

    private static final URI URI_ = URI.create("ws://localhost:9/mcp");
    private static final Duration WAIT = Duration.ofSeconds(5);

    /**
     * Channel fed by the test. An empty queue reads as would-block.
     */
    static final class ScriptedChannel implements FrameChannel {

        final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        final List<String> sent = new CopyOnWriteArrayList<>();
        final AtomicInteger closes = new AtomicInteger();
        volatile IOException sendFailure;

        @Override
        public Frame read() throws IOException {
            Object next = inbound.poll();
            if (next == null) {
                throw new SocketTimeoutException("would block");
            }
            if (next instanceof IOException error) {
                throw error;
            }
            return (Frame) next;
        }

        @Override
        public void sendText(String text) throws IOException {
            if (sendFailure != null) {
                throw sendFailure;
            }
            sent.add(text);
        }

        @Override
        public void close() {
            closes.incrementAndGet();
        }
    }

    @Test
    void textFramesReachCallbackAndOthersAreAbsorbed() throws Exception {
        ScriptedChannel channel = new ScriptedChannel();
        FramedTransport transport = new FramedTransport(URI_, uri -> channel);
        List<String> seen = new CopyOnWriteArrayList<>();
        transport.setOnMessage(seen::add);
        transport.start();

        channel.inbound.add(Frame.binary(new byte[] {1, 2, 3}));
        channel.inbound.add(Frame.ping(new byte[0]));
        channel.inbound.add(Frame.text("{\"id\":1}"));
        channel.inbound.add(Frame.pong(new byte[0]));
        channel.inbound.add(Frame.text("{\"id\":2}"));

        await().atMost(WAIT).until(() -> seen.size() == 2);
        assertThat(seen).containsExactly("{\"id\":1}", "{\"id\":2}");
        assertThat(transport.isConnected()).isTrue();
        transport.close();
    }

    @Test
    void closeFrameClosesTransport() throws Exception {
        ScriptedChannel channel = new ScriptedChannel();
        FramedTransport transport = new FramedTransport(URI_, uri -> channel);
        AtomicInteger closes = new AtomicInteger();
        transport.setOnClose(closes::incrementAndGet);
        transport.start();

        channel.inbound.add(Frame.close(1000, "bye"));

        await().atMost(WAIT).until(() -> !transport.isConnected());
        assertThat(closes).hasValue(1);
        assertThat(channel.closes.get()).isGreaterThanOrEqualTo(1);
        transport.close();
        assertThat(closes).hasValue(1);
    }

    @Test
    void readFailureIsFatal() throws Exception {
        ScriptedChannel channel = new ScriptedChannel();
        FramedTransport transport = new FramedTransport(URI_, uri -> channel);
        List<McpException> errors = new CopyOnWriteArrayList<>();
        transport.setOnError(errors::add);
        transport.start();

        channel.inbound.add(new IOException("connection reset"));

        await().atMost(WAIT).until(() -> !transport.isConnected());
        assertThat(errors).singleElement()
            .satisfies(e -> assertThat(e.getMessage()).isEqualTo("Transport error: WebSocket error: connection reset"));
    }

    @Test
    void wouldBlockIsNotAnError() {
        assertThat(FramedTransport.isWouldBlock(new SocketTimeoutException())).isTrue();
        assertThat(FramedTransport.isWouldBlock(new IOException("broken pipe"))).isFalse();
    }

    @Test
    void sendWritesTextFrame() throws Exception {
        ScriptedChannel channel = new ScriptedChannel();
        FramedTransport transport = new FramedTransport(URI_, uri -> channel);
        transport.start();

        transport.sendText("{\"jsonrpc\":\"2.0\"}");

        assertThat(channel.sent).containsExactly("{\"jsonrpc\":\"2.0\"}");
        transport.close();
    }

    @Test
    void sendFailureIsTransportError() throws Exception {
        ScriptedChannel channel = new ScriptedChannel();
        channel.sendFailure = new IOException("closed");
        FramedTransport transport = new FramedTransport(URI_, uri -> channel);
        transport.start();

        assertThatThrownBy(() -> transport.sendText("{}"))
            .isInstanceOf(McpException.class)
            .hasMessage("Transport error: Failed to send WebSocket message: closed");
        transport.close();
    }

    @Test
    void receiveTextIsUnsupported() throws Exception {
        FramedTransport transport = new FramedTransport(URI_, uri -> new ScriptedChannel());
        transport.start();

        assertThatThrownBy(transport::receiveText)
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.TRANSPORT));
        transport.close();
    }

    @Test
    void queueingWrapperGivesPullAccess() throws Exception {
        ScriptedChannel channel = new ScriptedChannel();
        QueueingTransport transport = new QueueingTransport(new FramedTransport(URI_, uri -> channel), WAIT);
        transport.start();

        channel.inbound.add(Frame.text("{\"id\":9}"));

        assertThat(transport.receiveText()).isEqualTo("{\"id\":9}");
        transport.close();
    }

    @Test
    void handshakeFailureIsTransportError() {
        FramedTransport transport = new FramedTransport(URI_, uri -> {
            throw new IOException("refused");
        });

        assertThatThrownBy(transport::start)
            .isInstanceOf(McpException.class)
            .hasMessage("Transport error: Failed to connect to WebSocket: refused");
        assertThat(transport.isConnected()).isFalse();
    }

    @Test
    void secondStartIsAlreadyConnected() throws Exception {
        FramedTransport transport = new FramedTransport(URI_, uri -> new ScriptedChannel());
        transport.start();

        assertThatThrownBy(transport::start)
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.ALREADY_CONNECTED));
        transport.close();
    }
}
