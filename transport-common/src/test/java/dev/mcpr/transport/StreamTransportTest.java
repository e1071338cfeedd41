package dev.mcpr.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.mcpr.error.ErrorKind;
import dev.mcpr.error.McpException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class StreamTransportTest {

    private static StreamTransport over(String input, ByteArrayOutputStream out) {
        return new StreamTransport(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
    }

    @Test
    void readsOneDocumentPerLine() throws Exception {
        StreamTransport transport = over("{\"a\":1}\r\n{\"b\":2}\n", new ByteArrayOutputStream());
        transport.start();

        assertThat(transport.receiveText()).isEqualTo("{\"a\":1}");
        assertThat(transport.receiveText()).isEqualTo("{\"b\":2}");
    }

    @Test
    void writesNewlineTerminatedDocuments() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StreamTransport transport = over("", out);
        transport.start();

        transport.sendText("{\"x\":\"é\"}");

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("{\"x\":\"é\"}\n");
    }

    @Test
    void endOfStreamIsTransportError() throws Exception {
        StreamTransport transport = over("", new ByteArrayOutputStream());
        List<McpException> errors = new ArrayList<>();
        transport.setOnError(errors::add);
        transport.start();

        assertThatThrownBy(transport::receiveText)
            .isInstanceOf(McpException.class)
            .hasMessage("Transport error: End of stream reached");
        assertThat(errors).hasSize(1);
    }

    @Test
    void sendBeforeStartIsNotConnected() {
        StreamTransport transport = over("", new ByteArrayOutputStream());

        assertThatThrownBy(() -> transport.sendText("{}"))
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_CONNECTED));
    }

    @Test
    void secondStartIsAlreadyConnected() throws Exception {
        StreamTransport transport = over("", new ByteArrayOutputStream());
        transport.start();

        assertThatThrownBy(transport::start)
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.ALREADY_CONNECTED));
        assertThat(transport.isConnected()).isTrue();
    }

    @Test
    void closeIsIdempotentAndNotifiesOnce() throws Exception {
        StreamTransport transport = over("", new ByteArrayOutputStream());
        AtomicInteger closes = new AtomicInteger();
        transport.setOnClose(closes::incrementAndGet);
        transport.start();

        transport.close();
        transport.close();

        assertThat(closes).hasValue(1);
        assertThat(transport.isConnected()).isFalse();
        assertThatThrownBy(() -> transport.sendText("{}"))
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.NOT_CONNECTED));
    }

    @Test
    void closedTransportCannotRestart() throws Exception {
        StreamTransport transport = over("", new ByteArrayOutputStream());
        transport.start();
        transport.close();

        assertThatThrownBy(transport::start)
            .isInstanceOfSatisfying(McpException.class, e -> assertThat(e.kind()).isEqualTo(ErrorKind.STATE));
    }

    @Test
    void closeOnIdleTransportDoesNotNotify() {
        StreamTransport transport = over("", new ByteArrayOutputStream());
        AtomicInteger closes = new AtomicInteger();
        transport.setOnClose(closes::incrementAndGet);

        transport.close();

        assertThat(closes).hasValue(0);
    }

    @Test
    void messageCallbackSeesBothDirections() throws Exception {
        StreamTransport transport = over("{\"in\":1}\n", new ByteArrayOutputStream());
        List<String> seen = new ArrayList<>();
        transport.setOnMessage(seen::add);
        transport.start();

        transport.sendText("{\"out\":1}");
        transport.receiveText();

        assertThat(seen).containsExactly("{\"out\":1}", "{\"in\":1}");
    }
}
