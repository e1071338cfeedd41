package dev.mcpr.transport.framed;

import java.io.IOException;
import java.net.URI;

/**
 * Performs the opening handshake of a framed connection.
 */
@FunctionalInterface
public interface FrameConnector {

    FrameChannel connect(URI uri) throws IOException;
}
