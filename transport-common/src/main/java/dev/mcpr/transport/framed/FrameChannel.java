package dev.mcpr.transport.framed;

import java.io.IOException;

/**
 * An established framed connection, as produced by a {@link FrameConnector}.
 */
public interface FrameChannel {

    /**
     * Read the next frame.
     * @throws java.net.SocketTimeoutException when no frame is available yet (would block)
     * @throws IOException on any other connection or protocol failure
     */
    Frame read() throws IOException;

    void sendText(String text) throws IOException;

    void close() throws IOException;
}
