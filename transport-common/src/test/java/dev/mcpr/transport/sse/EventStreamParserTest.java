package dev.mcpr.transport.sse;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class EventStreamParserTest {

    private static List<EventStreamParser.Event> parse(String stream) {
        EventStreamParser parser = new EventStreamParser();
        List<EventStreamParser.Event> events = new ArrayList<>();
        for (String line : stream.split("\n", -1)) {
            EventStreamParser.Event event = parser.accept(line);
            if (event != null) {
                events.add(event);
            }
        }
        return events;
    }

    @Test
    void parsesTypedAndDefaultEvents() {
        List<EventStreamParser.Event> events = parse(
            "event: endpoint\ndata: /message?clientId=abc\n\n: keep-alive\n\ndata: {\"id\":1}\n\n");

        assertThat(events).containsExactly(
            new EventStreamParser.Event("endpoint", "/message?clientId=abc"),
            new EventStreamParser.Event("message", "{\"id\":1}"));
    }

    @Test
    void joinsMultipleDataLines() {
        assertThat(parse("data: first\ndata:second\n\n"))
            .containsExactly(new EventStreamParser.Event("message", "first\nsecond"));
    }

    @Test
    void formatIsReadBackByParser() {
        String wire = EventStreamParser.format("endpoint", "/message") + EventStreamParser.format(null, "a\nb");

        assertThat(parse(wire)).containsExactly(
            new EventStreamParser.Event("endpoint", "/message"),
            new EventStreamParser.Event("message", "a\nb"));
    }
}
