package dev.mcpr.transport.sse;

/**
 * Incremental parser for the {@code text/event-stream} line format. Feed it one line at a time;
 * a blank line completes the pending event.
 */
final class EventStreamParser {

    record Event(String type, String data) {
    }

    private static final String DEFAULT_TYPE = "message";

    private String type;
    private StringBuilder data;

    /**
     * @return the completed event, or {@code null} when the line did not complete one
     */
    Event accept(String line) {
        if (line.isEmpty()) {
            return dispatch();
        }
        if (line.startsWith(":")) {
            return null;
        }
        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        switch (field) {
            case "event" -> type = value;
            case "data" -> {
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
            }
            default -> {
                // id and retry are not used
            }
        }
        return null;
    }

    private Event dispatch() {
        Event event = data == null ? null : new Event(type == null ? DEFAULT_TYPE : type, data.toString());
        type = null;
        data = null;
        return event;
    }

    /**
     * Render one event in wire form, splitting multi-line payloads across {@code data:} fields.
     */
    static String format(String type, String data) {
        StringBuilder out = new StringBuilder();
        if (type != null) {
            out.append("event: ").append(type).append('\n');
        }
        for (String line : data.split("\n", -1)) {
            out.append("data: ").append(line).append('\n');
        }
        return out.append('\n').toString();
    }
}
