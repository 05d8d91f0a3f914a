package org.wikimedia.analytics.mediasearch.core.session;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicates;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.wikimedia.analytics.mediasearch.core.EventFixtures.event;

public class TestSessionExtractor {

    private static final LocalDate DATA_DAY = LocalDate.of(2021, 3, 10);

    private final SessionExtractor extractor = new SessionExtractor(EventPredicates.action("search_new"));

    @Test
    public void testEarliestStartEventWins() {
        List<Event> events = Arrays.asList(
            event("2021-03-10T10:00:00Z", "a", "search_new"),
            event("2021-03-10T08:00:00Z", "a", "search_new"),
            event("2021-03-10T07:00:00Z", "a", "result_click")
        );

        Map<String, Instant> sessions = extractor.extract(events, DATA_DAY);

        assertEquals(1, sessions.size());
        assertEquals(Instant.parse("2021-03-10T08:00:00Z"), sessions.get("a"));
    }

    @Test
    public void testOnlySessionsStartingOnTheDataDay() {
        List<Event> events = Arrays.asList(
            event("2021-03-09T23:59:59Z", "before", "search_new"),
            event("2021-03-10T00:00:00Z", "first", "search_new"),
            event("2021-03-10T23:59:59Z", "last", "search_new"),
            event("2021-03-11T00:00:00Z", "after", "search_new"),
            // started the day before, continued on the data day
            event("2021-03-09T23:00:00Z", "continued", "search_new"),
            event("2021-03-10T01:00:00Z", "continued", "search_new")
        );

        Map<String, Instant> sessions = extractor.extract(events, DATA_DAY);

        assertEquals(Arrays.asList("first", "last"), new ArrayList<>(sessions.keySet()));
    }

    @Test
    public void testSessionsWithoutStartEventAreIgnored() {
        List<Event> events = Arrays.asList(
            event("2021-03-10T10:00:00Z", "a", "search_new"),
            event("2021-03-10T10:00:00Z", "c", "result_click"),
            event("2021-03-10T10:00:00Z", null, "search_new")
        );

        Map<String, Instant> sessions = extractor.extract(events, DATA_DAY);

        assertEquals(Arrays.asList("a"), new ArrayList<>(sessions.keySet()));
    }

    @Test
    public void testOrderedByStartTimeThenId() {
        List<Event> events = Arrays.asList(
            event("2021-03-10T12:00:00Z", "z", "search_new"),
            event("2021-03-10T11:00:00Z", "y", "search_new"),
            event("2021-03-10T11:00:00Z", "b", "search_new")
        );

        Map<String, Instant> sessions = extractor.extract(events, DATA_DAY);

        assertEquals(Arrays.asList("b", "y", "z"), new ArrayList<>(sessions.keySet()));
    }

    @Test
    public void testNoEvents() {
        assertTrue(extractor.extract(new ArrayList<>(), DATA_DAY).isEmpty());
    }
}
