package dev.mcpr.transport.framed;

/**
 * One frame read from a persistent framed connection.
 * @param type frame type
 * @param text payload of text frames, close reason of close frames
 * @param payload payload of binary, ping and pong frames
 * @param closeCode status code of close frames, 0 otherwise
 */
public record Frame(Type type, String text, byte[] payload, int closeCode) {

    public enum Type {
        TEXT, BINARY, PING, PONG, CLOSE
    }

    private static final byte[] EMPTY = new byte[0];

    public static Frame text(String text) {
        return new Frame(Type.TEXT, text, EMPTY, 0);
    }

    public static Frame binary(byte[] payload) {
        return new Frame(Type.BINARY, null, payload, 0);
    }

    public static Frame ping(byte[] payload) {
        return new Frame(Type.PING, null, payload, 0);
    }

    public static Frame pong(byte[] payload) {
        return new Frame(Type.PONG, null, payload, 0);
    }

    public static Frame close(int code, String reason) {
        return new Frame(Type.CLOSE, reason, EMPTY, code);
    }
}
