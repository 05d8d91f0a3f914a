package org.wikimedia.analytics.mediasearch.core.eventlog;

import java.io.IOException;
import java.time.Instant;

import junit.framework.TestCase;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionKey;

public class TestEventJsonParser extends TestCase {

    private final EventJsonParser parser = new EventJsonParser();

    public void testParse() throws IOException {
        Event event = parser.parse("{\"dt\": \"2021-03-10T12:00:00Z\", \"session_id\": \"abc\", "
            + "\"action\": \"result_click\", \"position\": 3, \"score\": 0.5, \"search_interface\": \"media_search\", "
            + "\"anonymous\": true, \"tags\": [\"a\", \"b\"], \"missing\": null}");

        assertEquals(Instant.parse("2021-03-10T12:00:00Z"), event.getTimestamp());
        assertEquals("abc", event.getSessionId());
        assertEquals("result_click", event.getAction());
        assertEquals(3L, event.getAttribute("position"));
        assertEquals(0.5, event.getAttribute("score"));
        assertEquals("media_search", event.getAttribute("search_interface"));
        assertEquals(Boolean.TRUE, event.getAttribute("anonymous"));
        assertEquals("[\"a\",\"b\"]", event.getAttribute("tags"));
        assertFalse(event.hasAttribute("missing"));
        assertFalse(event.hasAttribute("dt"));
        assertEquals(new PartitionKey(2021, 3, 10), event.getPartitionKey());
    }

    public void testNestedAttributesAreFlattened() throws IOException {
        Event event = parser.parse("{\"dt\": \"2021-03-10 12:00:00\", \"session_id\": \"abc\", "
            + "\"action\": \"filter_change\", \"attributes\": {\"filter_type\": \"license\", \"filter_value\": \"\"}}");

        assertEquals("license", event.getAttribute("filter_type"));
        assertEquals("", event.getAttribute("filter_value"));
        assertFalse(event.hasAttribute("attributes"));
    }

    public void testPartitionFields() throws IOException {
        Event event = parser.parse("{\"dt\": \"2021-03-10T23:59:00Z\", \"session_id\": \"abc\", "
            + "\"action\": \"search_new\", \"year\": 2021, \"month\": 3, \"day\": 11}");

        assertEquals(new PartitionKey(2021, 3, 11), event.getPartitionKey());
        assertFalse(event.hasAttribute("day"));
    }

    public void testMissingTimestamp() {
        try {
            parser.parse("{\"session_id\": \"abc\", \"action\": \"search_new\"}");
            fail("An event without timestamp should be rejected");
        } catch (IOException e) {
            // expected
        }
    }

    public void testInvalidTimestamp() {
        try {
            parser.parse("{\"dt\": \"yesterday\", \"session_id\": \"abc\", \"action\": \"search_new\"}");
            fail("An event with an invalid timestamp should be rejected");
        } catch (IOException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    public void testNotAnObject() {
        try {
            parser.parse("[1, 2]");
            fail("Only objects are events");
        } catch (IOException e) {
            // expected
        }
    }
}
