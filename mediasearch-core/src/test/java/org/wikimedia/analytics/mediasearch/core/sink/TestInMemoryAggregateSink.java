package org.wikimedia.analytics.mediasearch.core.sink;

import java.util.Arrays;

import junit.framework.TestCase;

import static org.wikimedia.analytics.mediasearch.core.sink.AggregateTables.sessions;

public class TestInMemoryAggregateSink extends TestCase {

    public void testAppendKeepsDuplicates() throws Exception {
        InMemoryAggregateSink sink = new InMemoryAggregateSink();

        WriteMode.APPEND.write(sink, sessions("t", "2021-03-10", "media_search", 3L));
        WriteMode.APPEND.write(sink, sessions("t", "2021-03-10", "media_search", 3L));

        assertEquals(2, sink.getRows("t").size());
        assertEquals(sink.getRows("t").get(0), sink.getRows("t").get(1));
    }

    public void testReplaceIsIdempotent() throws Exception {
        InMemoryAggregateSink sink = new InMemoryAggregateSink();
        sink.append(sessions("t", "2021-03-09", "media_search", 2L));

        WriteMode.REPLACE.write(sink, sessions("t", "2021-03-10", "media_search", 3L));
        WriteMode.REPLACE.write(sink, sessions("t", "2021-03-10", "media_search", 3L));

        assertEquals(2, sink.getRows("t").size());
        assertEquals("2021-03-09", sink.getRows("t").get(0).getLogDate().toString());
    }

    public void testTableNames() throws Exception {
        InMemoryAggregateSink sink = new InMemoryAggregateSink();
        sink.append(sessions("b", "2021-03-10"));
        sink.append(sessions("a", "2021-03-10"));

        assertEquals(Arrays.asList("b", "a"), sink.getTableNames());
        assertTrue(sink.getRows("unknown").isEmpty());
    }

    public void testWriteModeFromName() {
        assertEquals(WriteMode.APPEND, WriteMode.fromName("append"));
        assertEquals(WriteMode.REPLACE, WriteMode.fromName(" Replace "));
        try {
            WriteMode.fromName("upsert");
            fail("Unknown write modes should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
