package org.wikimedia.analytics.mediasearch.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import junit.framework.TestCase;

public class TestRunWindow extends TestCase {

    private final RunWindow window = RunWindow.forDataDay(LocalDate.of(2021, 3, 10));

    public void testScanDays() {
        assertEquals(LocalDate.of(2021, 3, 9), window.getScanStart());
        assertEquals(LocalDate.of(2021, 3, 11), window.getScanEnd());
        assertEquals("year = 2021 AND month = 3 AND day BETWEEN 9 AND 11", window.getScanPredicate().toString());
    }

    public void testScanPredicateAcrossMonths() {
        RunWindow firstOfMonth = RunWindow.forDataDay(LocalDate.of(2021, 3, 1));

        assertEquals(
            "(w.year = 2021 AND w.month = 2 AND w.day >= 28) OR (w.year = 2021 AND w.month = 3 AND w.day <= 2)",
            firstOfMonth.getScanPredicate("w").toString());
    }

    public void testDayStart() {
        assertEquals(Instant.parse("2021-03-10T00:00:00Z"), window.getDayStart());
    }

    public void testDefaultCutoff() {
        assertEquals(Instant.parse("2021-03-11T01:00:00Z"), window.getCutoffTime());
    }

    public void testCustomCutoff() {
        assertEquals(Instant.parse("2021-03-11T00:00:00Z"), window.getCutoffTime(Duration.ZERO));
        assertEquals(Instant.parse("2021-03-11T03:30:00Z"), window.getCutoffTime(Duration.ofMinutes(210)));
    }

    public void testNegativeGrace() {
        try {
            window.getCutoffTime(Duration.ofMinutes(-1));
            fail("A negative grace should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testFromClockUsesYesterdayInUtc() {
        // Still the 10th in Los Angeles, already the 11th in UTC
        Clock clock = Clock.fixed(Instant.parse("2021-03-11T02:00:00Z"), ZoneId.of("America/Los_Angeles"));

        assertEquals(LocalDate.of(2021, 3, 10), RunWindow.fromClock(clock).getDataDay());
    }
}
