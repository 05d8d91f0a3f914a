package org.wikimedia.analytics.mediasearch.core.aggregate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.Test;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicates;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelDefinition;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelMatcher;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelStep;
import org.wikimedia.analytics.mediasearch.core.funnel.SessionFunnel;
import org.wikimedia.analytics.mediasearch.core.session.SessionExtractor;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.wikimedia.analytics.mediasearch.core.EventFixtures.event;

public class TestAggregator {

    private static final LocalDate DATA_DAY = LocalDate.of(2021, 3, 10);
    private static final double DELTA = 1e-9;

    private final Aggregator aggregator = new Aggregator(DATA_DAY);

    private final FunnelDefinition funnel = new FunnelDefinition("media", Arrays.asList(
        FunnelStep.required("dialog_open", EventPredicates.action("dialog_open")),
        FunnelStep.required("search", EventPredicates.action("search")),
        FunnelStep.required("result_choose", EventPredicates.action("result_choose")),
        FunnelStep.required("media_insert", EventPredicates.action("media_insert"))
    ));

    private List<SessionFunnel> match(FunnelDefinition definition, List<Event> events) {
        Map<String, Instant> sessions = new SessionExtractor(definition).extract(events, DATA_DAY);
        return new FunnelMatcher(definition).match(sessions, events, DATA_DAY);
    }

    @Test
    public void testThreeSessionScenario() {
        List<Event> events = Arrays.asList(
            // A completes every step
            event("2021-03-10T09:00:00Z", "A", "dialog_open"),
            event("2021-03-10T09:00:10Z", "A", "search"),
            event("2021-03-10T09:00:20Z", "A", "result_choose"),
            event("2021-03-10T09:00:30Z", "A", "media_insert"),
            // B stops after searching
            event("2021-03-10T10:00:00Z", "B", "dialog_open"),
            event("2021-03-10T10:00:10Z", "B", "search"),
            // C never opened the dialog
            event("2021-03-10T11:00:10Z", "C", "search"),
            event("2021-03-10T11:00:20Z", "C", "result_choose"),
            event("2021-03-10T11:00:30Z", "C", "media_insert")
        );

        AggregateTable table = aggregator.stepCounts("ve_media_funnel_aggregates", funnel.getStepNames(),
            match(funnel, events), Collections.<SessionDimension>emptyList());

        assertEquals(Arrays.asList("log_date", "num_dialog_open", "num_search", "num_result_choose",
            "num_media_insert"), table.getColumns());
        assertEquals(1, table.getRows().size());
        AggregateRow row = table.getRows().get(0);
        assertEquals(DATA_DAY, row.getLogDate());
        assertEquals(2L, row.getMetric("num_dialog_open"));
        assertEquals(2L, row.getMetric("num_search"));
        assertEquals(1L, row.getMetric("num_result_choose"));
        assertEquals(1L, row.getMetric("num_media_insert"));
    }

    @Test
    public void testCountsOnlyPresentSteps() {
        List<Event> events = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            events.add(event("2021-03-10T12:00:0" + i + "Z", "s" + i, "dialog_open"));
        }
        // two of five sessions search, none of them goes further
        events.add(event("2021-03-10T12:01:00Z", "s1", "search"));
        events.add(event("2021-03-10T12:01:00Z", "s3", "search"));

        AggregateRow row = aggregator.stepCounts("t", funnel.getStepNames(), match(funnel, events),
            Collections.<SessionDimension>emptyList()).getRows().get(0);

        assertEquals(5L, row.getMetric("num_dialog_open"));
        assertEquals(2L, row.getMetric("num_search"));
        assertEquals(0L, row.getMetric("num_result_choose"));
        assertEquals(0L, row.getMetric("num_media_insert"));
    }

    @Test
    public void testNoSessionsStillGivesARow() {
        AggregateTable table = aggregator.stepCounts("t", funnel.getStepNames(),
            Collections.<SessionFunnel>emptyList(), Collections.<SessionDimension>emptyList());

        assertEquals(1, table.getRows().size());
        assertEquals(0L, table.getRows().get(0).getMetric("num_dialog_open"));
    }

    @Test
    public void testDimensionsWithDeclaredValues() {
        FunnelDefinition search = new FunnelDefinition("search", Arrays.asList(
            FunnelStep.required("search_new", EventPredicates.action("search_new")),
            FunnelStep.required("result_click", EventPredicates.action("result_click"))
        ));
        SessionDimension searchInterface = SessionDimension
            .stepAttribute("search_interface", "search_new", "search_interface", "unknown")
            .withDeclaredValues(Arrays.asList("special_search", "media_search"));

        List<Event> events = Arrays.asList(
            event("2021-03-10T12:00:00Z", "a", "search_new", "search_interface", "media_search"),
            event("2021-03-10T12:00:05Z", "a", "result_click"),
            event("2021-03-10T12:00:00Z", "b", "search_new", "search_interface", "media_search"),
            event("2021-03-10T12:00:00Z", "c", "search_new")
        );

        AggregateTable table = aggregator.stepCounts("t", search.getStepNames(), match(search, events),
            Collections.singletonList(searchInterface));

        assertEquals(Arrays.asList("log_date", "search_interface", "num_search_new", "num_result_click"),
            table.getColumns());
        assertEquals(3, table.getRows().size());

        AggregateRow media = table.getRows().get(0);
        assertEquals("media_search", media.getDimension("search_interface"));
        assertEquals(2L, media.getMetric("num_search_new"));
        assertEquals(1L, media.getMetric("num_result_click"));

        AggregateRow special = table.getRows().get(1);
        assertEquals("special_search", special.getDimension("search_interface"));
        assertEquals(0L, special.getMetric("num_search_new"));

        AggregateRow unknown = table.getRows().get(2);
        assertEquals("unknown", unknown.getDimension("search_interface"));
        assertEquals(1L, unknown.getMetric("num_search_new"));
    }

    @Test
    public void testCategoryCountsNormalizeBlankValues() {
        List<Event> changes = Arrays.asList(
            event("2021-03-10T12:00:00Z", "a", "filter_change", "filter_type", "license", "filter_value", ""),
            event("2021-03-10T12:00:01Z", "a", "filter_change", "filter_type", "license", "filter_value", "  "),
            event("2021-03-10T12:00:02Z", "b", "filter_change", "filter_type", "license"),
            event("2021-03-10T12:00:03Z", "b", "filter_change", "filter_type", "license", "filter_value", "cc-by"),
            event("2021-03-10T12:00:04Z", "c", "filter_change", "filter_type", "filemime", "filter_value", "png"),
            event("2021-03-10T12:00:05Z", "c", "filter_change", "filter_value", "png")
        );

        AggregateTable table = aggregator.categoryCounts("filters", changes, "filter_type", "filter_value",
            "num_changes");

        assertEquals(Arrays.asList("log_date", "filter_type", "filter_value", "num_changes"), table.getColumns());
        assertEquals(3, table.getRows().size());
        assertEquals(Arrays.asList("2021-03-10", "filemime", "png"), table.getRows().get(0).getKey());
        assertEquals(1L, table.getRows().get(0).getMetric("num_changes"));
        assertEquals(Arrays.asList("2021-03-10", "license", "cc-by"), table.getRows().get(1).getKey());
        assertEquals(Arrays.asList("2021-03-10", "license", "reset"), table.getRows().get(2).getKey());
        assertEquals(3L, table.getRows().get(2).getMetric("num_changes"));
        for (AggregateRow row : table.getRows()) {
            assertTrue(!row.getDimension("filter_value").trim().isEmpty());
        }
    }

    @Test
    public void testSessionsPerCategory() {
        FunnelDefinition filters = new FunnelDefinition("filters", Arrays.asList(
            FunnelStep.required("search_start", EventPredicates.action("search_new")),
            FunnelStep.branch("filter_change", EventPredicates.action("filter_change"), "search_start")
        ));
        List<Event> events = Arrays.asList(
            event("2021-03-10T12:00:00Z", "a", "search_new"),
            event("2021-03-10T12:00:01Z", "a", "filter_change", "filter_type", "license"),
            event("2021-03-10T12:00:02Z", "a", "filter_change", "filter_type", "license"),
            event("2021-03-10T12:00:03Z", "a", "filter_change", "filter_type", "filemime"),
            event("2021-03-10T13:00:00Z", "b", "search_new"),
            event("2021-03-10T13:00:01Z", "b", "filter_change", "filter_type", "license"),
            event("2021-03-10T13:00:02Z", "b", "result_click", "filter_type", "filemime")
        );

        AggregateTable table = aggregator.sessionsPerCategory("sessions", match(filters, events),
            EventPredicates.action("filter_change"), "filter_type", Aggregator.SESSIONS_METRIC);

        assertEquals(2, table.getRows().size());
        assertEquals("filemime", table.getRows().get(0).getDimension("filter_type"));
        assertEquals(1L, table.getRows().get(0).getMetric("num_sessions"));
        assertEquals("license", table.getRows().get(1).getDimension("filter_type"));
        assertEquals(2L, table.getRows().get(1).getMetric("num_sessions"));
    }

    @Test
    public void testClickPositions() {
        FunnelDefinition search = new FunnelDefinition("search", Arrays.asList(
            FunnelStep.required("search_new", EventPredicates.action("search_new")),
            FunnelStep.required("result_click", EventPredicates.action("result_click"))
        ));
        List<Event> events = Arrays.asList(
            event("2021-03-10T12:00:00Z", "a", "search_new"),
            event("2021-03-10T12:00:01Z", "a", "result_click", "position", 1L),
            event("2021-03-10T12:00:02Z", "a", "result_click", "position", 5L),
            event("2021-03-10T13:00:00Z", "b", "search_new"),
            event("2021-03-10T13:00:01Z", "b", "result_click", "position", "2"),
            event("2021-03-10T13:00:02Z", "b", "result_click", "position", 2.0),
            event("2021-03-10T14:00:00Z", "c", "search_new")
        );

        AggregateTable table = aggregator.clickPositions("positions", match(search, events), "result_click",
            "position", Collections.<SessionDimension>emptyList());

        assertEquals(Arrays.asList("log_date", "num_sessions", "num_click_sessions", "num_clicks",
            "median_position"), table.getColumns());
        AggregateRow row = table.getRows().get(0);
        assertEquals(3L, row.getMetric("num_sessions"));
        assertEquals(2L, row.getMetric("num_click_sessions"));
        assertEquals(4L, row.getMetric("num_clicks"));
        assertEquals(2.0, row.getMetric("median_position").doubleValue(), DELTA);
    }

    @Test
    public void testClickPositionsWithoutClicks() {
        FunnelDefinition search = new FunnelDefinition("search", Arrays.asList(
            FunnelStep.required("search_new", EventPredicates.action("search_new")),
            FunnelStep.required("result_click", EventPredicates.action("result_click"))
        ));
        List<Event> events = Collections.singletonList(event("2021-03-10T14:00:00Z", "c", "search_new"));

        AggregateRow row = aggregator.clickPositions("positions", match(search, events), "result_click",
            "position", Collections.<SessionDimension>emptyList()).getRows().get(0);

        assertEquals(1L, row.getMetric("num_sessions"));
        assertEquals(0L, row.getMetric("num_clicks"));
        assertEquals(Percentile.EMPTY_SENTINEL, row.getMetric("median_position").doubleValue(), DELTA);
    }

    @Test
    public void testCategoryNormalizer() {
        assertEquals("reset", CategoryNormalizer.normalize(null));
        assertEquals("reset", CategoryNormalizer.normalize(""));
        assertEquals("reset", CategoryNormalizer.normalize(" \t"));
        assertEquals("cc-by", CategoryNormalizer.normalize("cc-by"));
        assertEquals("3", CategoryNormalizer.normalize(3L));
    }
}
