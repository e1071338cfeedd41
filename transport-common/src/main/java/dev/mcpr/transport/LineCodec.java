package dev.mcpr.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Newline delimited UTF-8 framing used by the stream and socket transports.
 */
public final class LineCodec {

    private LineCodec() {
    }

    public static void writeLine(OutputStream out, String json) throws IOException {
        out.write(json.getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }

    /**
     * Stateful line reader. Bytes of a partially received line survive a
     * {@link java.net.SocketTimeoutException} so a timed read can simply be retried.
     */
    public static final class LineReader {

        private final InputStream in;
        private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

        public LineReader(InputStream in) {
            this.in = in;
        }

        /**
         * @return the next line without its terminator, or {@code null} on a clean end of stream
         */
        public String readLine() throws IOException {
            while (true) {
                int b = in.read();
                if (b == -1) {
                    if (pending.size() == 0) {
                        return null;
                    }
                    return drain();
                }
                if (b == '\n') {
                    return drain();
                }
                pending.write(b);
            }
        }

        private String drain() {
            String line = pending.toString(StandardCharsets.UTF_8);
            pending.reset();
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            return line;
        }
    }
}
