package org.wikimedia.analytics.mediasearch.core.sink;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import static org.junit.Assert.assertEquals;
import static org.wikimedia.analytics.mediasearch.core.sink.AggregateTables.sessions;

public class TestTsvAggregateSink {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private TsvAggregateSink sink;

    @Before
    public void setUp() {
        sink = new TsvAggregateSink(temporaryFolder.getRoot());
    }

    private List<String> lines(String table) throws IOException {
        return FileUtils.readLines(sink.fileOf(table), StandardCharsets.UTF_8);
    }

    @Test
    public void testAppendWritesHeaderOnce() throws IOException {
        sink.append(sessions("t", "2021-03-10", "media_search", 3L, "special_search", 1L));
        sink.append(sessions("t", "2021-03-10", "media_search", 3L, "special_search", 1L));

        assertEquals(Arrays.asList(
            "log_date\tsearch_interface\tnum_sessions",
            "2021-03-10\tmedia_search\t3",
            "2021-03-10\tspecial_search\t1",
            "2021-03-10\tmedia_search\t3",
            "2021-03-10\tspecial_search\t1"
        ), lines("t"));
    }

    @Test
    public void testReplaceOnlyTouchesItsLogDate() throws IOException {
        sink.append(sessions("t", "2021-03-09", "media_search", 2L));
        sink.append(sessions("t", "2021-03-10", "media_search", 3L));
        sink.append(sessions("t", "2021-03-10", "media_search", 3L));

        sink.replace(sessions("t", "2021-03-10", "media_search", 4L));

        assertEquals(Arrays.asList(
            "log_date\tsearch_interface\tnum_sessions",
            "2021-03-09\tmedia_search\t2",
            "2021-03-10\tmedia_search\t4"
        ), lines("t"));
    }

    @Test
    public void testReplaceCreatesTheFile() throws IOException {
        sink.replace(sessions("t", "2021-03-10", "media_search", 4L));

        assertEquals(2, lines("t").size());
    }

    @Test
    public void testValuesAreSanitized() throws IOException {
        sink.append(sessions("t", "2021-03-10", "media\tsearch\n", 1L));

        assertEquals("2021-03-10\tmedia search \t1", lines("t").get(1));
    }

    @Test(expected = IOException.class)
    public void testMismatchingHeader() throws IOException {
        File file = sink.fileOf("t");
        FileUtils.writeStringToFile(file, "log_date\tother\tnum_sessions\n", StandardCharsets.UTF_8);

        sink.append(sessions("t", "2021-03-10", "media_search", 1L));
    }
}
