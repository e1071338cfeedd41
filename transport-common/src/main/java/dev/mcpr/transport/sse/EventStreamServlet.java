package dev.mcpr.transport.sse;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the event stream on GET {@code /events} and accepts client documents on POST {@code /message}.
 * A subscription stays open while the server is running and keeps flushing its queue after shutdown
 * began until the queue is empty.
 */
final class EventStreamServlet extends HttpServlet {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamServlet.class);

    private static final long POLL_MILLIS = 100;

    private final transient EventStreamServerTransport transport;

    EventStreamServlet(EventStreamServerTransport transport) {
        this.transport = transport;
    }

    @Override
    protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
        if (!EventStreamTransport.EVENTS_PATH.equals(request.getServletPath())) {
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType("text/event-stream");
        response.setCharacterEncoding("UTF-8");
        response.setHeader("Cache-Control", "no-cache");
        response.setHeader("Connection", "keep-alive");
        ServletOutputStream out = response.getOutputStream();

        EventStreamServerTransport.ClientSession session = transport.register();
        try {
            String endpoint = EventStreamTransport.MESSAGE_PATH + "?" + EventStreamTransport.CLIENT_ID_PARAM + "=" + session.id();
            write(out, response, EventStreamParser.format(EventStreamTransport.ENDPOINT_EVENT, endpoint));
            long keepAliveNanos = transport.keepAlive().toNanos();
            long lastWrite = System.nanoTime();
            while (transport.isConnected() || !session.outbound().isEmpty()) {
                String message = session.outbound().poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (message != null) {
                    write(out, response, EventStreamParser.format(null, message));
                    lastWrite = System.nanoTime();
                } else if (System.nanoTime() - lastWrite >= keepAliveNanos) {
                    write(out, response, ": keep-alive\n\n");
                    lastWrite = System.nanoTime();
                }
            }
        } catch (IOException e) {
            LOGGER.debug("SSE client {} went away: {}", session.id(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            transport.unregister(session);
        }
    }

    @Override
    protected void doPost(HttpServletRequest request, HttpServletResponse response) throws IOException {
        if (!EventStreamTransport.MESSAGE_PATH.equals(request.getServletPath())) {
            response.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        if (!transport.isConnected()) {
            response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Server is shutting down");
            return;
        }
        String clientId = request.getParameter(EventStreamTransport.CLIENT_ID_PARAM);
        if (clientId == null || clientId.isBlank()) {
            response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Missing clientId");
            return;
        }
        if (!transport.isKnown(clientId)) {
            response.sendError(HttpServletResponse.SC_NOT_FOUND, "Unknown clientId");
            return;
        }
        String body = new String(request.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
        if (body.isEmpty()) {
            response.sendError(HttpServletResponse.SC_BAD_REQUEST, "Empty message body");
            return;
        }
        transport.deliver(clientId, body);
        response.setStatus(HttpServletResponse.SC_ACCEPTED);
    }

    private static void write(ServletOutputStream out, HttpServletResponse response, String chunk) throws IOException {
        out.write(chunk.getBytes(StandardCharsets.UTF_8));
        out.flush();
        response.flushBuffer();
    }
}
