package dev.mcpr.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * Correlation identifier of a JSON-RPC request: either a number or a string.
 */
public final class RequestId {

    private final Long number;
    private final String text;

    private RequestId(Long number, String text) {
        this.number = number;
        this.text = text;
    }

    public static RequestId of(long number) {
        return new RequestId(number, null);
    }

    public static RequestId of(String text) {
        return new RequestId(null, Objects.requireNonNull(text, "text"));
    }

    /**
     * Read an id from its JSON form.
     * @return the id, or {@code null} when the node is missing, null or of another type
     */
    public static RequestId fromJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return of(node.longValue());
        }
        if (node.isTextual()) {
            return of(node.textValue());
        }
        return null;
    }

    public JsonNode toJson() {
        return number != null ? JsonNodeFactory.instance.numberNode(number) : JsonNodeFactory.instance.textNode(text);
    }

    public boolean isNumeric() {
        return number != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RequestId other)) {
            return false;
        }
        return Objects.equals(number, other.number) && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, text);
    }

    @Override
    public String toString() {
        return number != null ? number.toString() : text;
    }
}
