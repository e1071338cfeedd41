package dev.mcpr.transport.framed;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

/**
 * {@link FrameConnector} backed by the Spring WebSocket client running on the JSR-356 container.
 * Frames pushed by the container are queued and handed out by {@link FrameChannel#read()}.
 */
public class SpringWebSocketConnector implements FrameConnector {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpringWebSocketConnector.class);

    private final WebSocketClient client;
    private final Duration handshakeTimeout;

    public SpringWebSocketConnector() {
        this(new StandardWebSocketClient(), Duration.ofSeconds(10));
    }

    public SpringWebSocketConnector(WebSocketClient client, Duration handshakeTimeout) {
        this.client = client;
        this.handshakeTimeout = handshakeTimeout;
    }

    @Override
    public FrameChannel connect(URI uri) throws IOException {
        SessionChannel channel = new SessionChannel(FramedTransport.POLL_INTERVAL);
        try {
            WebSocketSession session = client.execute(channel, new WebSocketHttpHeaders(), uri)
                .get(handshakeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            channel.attach(session);
            LOGGER.debug("WebSocket handshake with {} completed, session {}", uri, session.getId());
            return channel;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new IOException("WebSocket handshake with " + uri + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IOException("WebSocket handshake with " + uri + " timed out after " + handshakeTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted during WebSocket handshake");
        }
    }

    /**
     * Bridges the container callbacks to the pull-style {@link FrameChannel}.
     */
    static final class SessionChannel extends AbstractWebSocketHandler implements FrameChannel {

        private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
        private final ReentrantLock sendLock = new ReentrantLock();
        private final Duration pollInterval;

        private volatile WebSocketSession session;

        SessionChannel(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        void attach(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            attach(session);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            inbound.offer(Frame.text(message.getPayload()));
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
            inbound.offer(Frame.binary(copy(message.getPayload())));
        }

        @Override
        protected void handlePongMessage(WebSocketSession session, PongMessage message) {
            inbound.offer(Frame.pong(copy(message.getPayload())));
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            LOGGER.warn("Transport error detected on WebSocket {}", session.getId(), exception);
            inbound.offer(exception instanceof IOException io ? io : new IOException(exception.getMessage(), exception));
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            inbound.offer(Frame.close(status.getCode(), status.getReason()));
        }

        @Override
        public Frame read() throws IOException {
            Object next;
            try {
                next = inbound.poll(pollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while waiting for a frame");
            }
            if (next == null) {
                throw new SocketTimeoutException("No frame available");
            }
            if (next instanceof IOException error) {
                throw error;
            }
            return (Frame) next;
        }

        @Override
        public void sendText(String text) throws IOException {
            WebSocketSession current = session;
            if (current == null || !current.isOpen()) {
                throw new IOException("WebSocket session is closed");
            }
            sendLock.lock();
            try {
                current.sendMessage(new TextMessage(text));
            } finally {
                sendLock.unlock();
            }
        }

        @Override
        public void close() throws IOException {
            WebSocketSession current = session;
            if (current == null) {
                return;
            }
            sendLock.lock();
            try {
                if (current.isOpen()) {
                    current.close(CloseStatus.NORMAL);
                }
            } finally {
                sendLock.unlock();
            }
        }

        private static byte[] copy(ByteBuffer buffer) {
            ByteBuffer view = buffer.duplicate();
            byte[] bytes = new byte[view.remaining()];
            view.get(bytes);
            return bytes;
        }
    }
}
