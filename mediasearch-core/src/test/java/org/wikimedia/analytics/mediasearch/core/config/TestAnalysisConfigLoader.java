package org.wikimedia.analytics.mediasearch.core.config;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateRow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;
import org.wikimedia.analytics.mediasearch.core.analysis.Analysis;
import org.wikimedia.analytics.mediasearch.core.analysis.FunnelAnalysis;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicate;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import static org.wikimedia.analytics.mediasearch.core.EventFixtures.event;

@RunWith(JUnitParamsRunner.class)
public class TestAnalysisConfigLoader {

    private static final RunWindow WINDOW = RunWindow.forDataDay(LocalDate.of(2021, 3, 10));

    private final AnalysisConfigLoader loader = new AnalysisConfigLoader();

    private Map<String, Analysis> loadDefault() throws ConfigLoadingException {
        Map<String, Analysis> analyses = new LinkedHashMap<>();
        for (Analysis analysis : loader.loadDefault()) {
            analyses.put(analysis.getName(), analysis);
        }
        return analyses;
    }

    private static Map<String, AggregateTable> byName(List<AggregateTable> tables) {
        Map<String, AggregateTable> byName = new LinkedHashMap<>();
        for (AggregateTable table : tables) {
            byName.put(table.getName(), table);
        }
        return byName;
    }

    @Test
    public void testDefaultAnalyses() throws Exception {
        Map<String, Analysis> analyses = loadDefault();

        assertEquals(Arrays.asList("commons_search", "mediasearch_success", "mediasearch_filter_usage",
            "ve_media_funnel"), new ArrayList<>(analyses.keySet()));

        FunnelAnalysis success = (FunnelAnalysis) analyses.get("mediasearch_success");
        assertEquals(Arrays.asList("search_new", "result_click", "detail_opened", "copy_action", "dialog_closed",
            "file_page_visit"), success.getVariants().get(0).getStepNames());
        assertNotNull(success.getClickPositions());
        assertEquals("mediasearch_click_position_aggregates", success.getClickPositions().getTable());

        FunnelAnalysis veMedia = (FunnelAnalysis) analyses.get("ve_media_funnel");
        assertEquals(2, veMedia.getVariants().size());
        assertEquals("path_type", veMedia.getDimensions().get(0).getColumn());
        assertEquals(Arrays.asList("add", "edit"), veMedia.getDimensions().get(0).getDeclaredValues());
    }

    @Test
    public void testDefaultCommonsSearch() throws Exception {
        Analysis commonsSearch = loadDefault().get("commons_search");

        List<AggregateTable> tables = commonsSearch.run(WINDOW, Arrays.asList(
            event("2021-03-10T09:00:00Z", "a", "search_new", "search_interface", "media_search"),
            event("2021-03-10T09:00:01Z", "a", "search_results"),
            event("2021-03-10T09:00:05Z", "a", "result_click", "position", 1L),
            event("2021-03-10T10:00:00Z", "b", "search_new", "search_interface", "special_search"),
            event("2021-03-10T10:00:01Z", "b", "search_results")
        ));

        AggregateTable table = byName(tables).get("commons_search_aggregates");
        assertEquals(2, table.getRows().size());
        AggregateRow media = table.getRows().get(0);
        assertEquals("media_search", media.getDimension("search_interface"));
        assertEquals(1L, media.getMetric("num_result_click"));
        AggregateRow special = table.getRows().get(1);
        assertEquals("special_search", special.getDimension("search_interface"));
        assertEquals(1L, special.getMetric("num_search_results"));
        assertEquals(0L, special.getMetric("num_result_click"));
    }

    @Test
    public void testDefaultMediaSearchSuccess() throws Exception {
        Analysis success = loadDefault().get("mediasearch_success");

        Map<String, AggregateTable> tables = byName(success.run(WINDOW, Arrays.asList(
            event("2021-03-10T09:00:00Z", "a", "search_new", "search_interface", "media_search"),
            event("2021-03-10T09:00:05Z", "a", "result_click", "position", 2L),
            event("2021-03-10T09:00:06Z", "a", "detail_open"),
            event("2021-03-10T09:00:09Z", "a", "copy_embed"),
            event("2021-03-10T09:00:20Z", "a", "detail_close_escape"),
            event("2021-03-10T09:00:30Z", "a", "result_click", "position", 6L),
            // special search sessions are not media search sessions
            event("2021-03-10T10:00:00Z", "b", "search_new", "search_interface", "special_search"),
            event("2021-03-10T10:00:05Z", "b", "result_click", "position", 1L)
        )));

        AggregateRow row = tables.get("mediasearch_success_aggregates").getRows().get(0);
        assertEquals(1L, row.getMetric("num_search_new"));
        assertEquals(1L, row.getMetric("num_result_click"));
        assertEquals(1L, row.getMetric("num_detail_opened"));
        assertEquals(1L, row.getMetric("num_copy_action"));
        assertEquals(1L, row.getMetric("num_dialog_closed"));
        assertEquals(0L, row.getMetric("num_file_page_visit"));

        AggregateRow positions = tables.get("mediasearch_click_position_aggregates").getRows().get(0);
        assertEquals(2L, positions.getMetric("num_clicks"));
        assertEquals(4.0, positions.getMetric("median_position").doubleValue(), 1e-9);
    }

    @Test
    public void testDefaultFilterUsage() throws Exception {
        Analysis filterUsage = loadDefault().get("mediasearch_filter_usage");

        Map<String, AggregateTable> tables = byName(filterUsage.run(WINDOW, Arrays.asList(
            event("2021-03-10T09:00:00Z", "a", "search_new", "search_interface", "media_search"),
            event("2021-03-10T09:00:01Z", "a", "filter_change", "filter_type", "filemime", "filter_value", "png"),
            event("2021-03-10T09:00:02Z", "a", "filter_change", "filter_type", "filemime", "filter_value", "")
        )));

        AggregateTable changes = tables.get("mediasearch_filter_change_aggregates");
        assertEquals(2, changes.getRows().size());
        assertEquals("png", changes.getRows().get(0).getDimension("filter_value"));
        assertEquals("reset", changes.getRows().get(1).getDimension("filter_value"));
        assertEquals(1L,
            tables.get("mediasearch_filters_per_session_aggregates").getRows().get(0).getMetric("num_sessions"));
    }

    @Test
    public void testPredicate() throws Exception {
        String yaml = "action: [detail_close, detail_close_escape]\n"
            + "attributes:\n"
            + "  search_interface: media_search\n"
            + "not:\n"
            + "  has_attribute: automated\n";
        EventPredicate predicate = loader.parsePredicate(new ObjectMapper(new YAMLFactory()).readTree(yaml), "test");

        Event close = event("2021-03-10T09:00:00Z", "a", "detail_close", "search_interface", "media_search");
        Event automated = event("2021-03-10T09:00:00Z", "a", "detail_close", "search_interface", "media_search",
            "automated", true);
        Event otherInterface = event("2021-03-10T09:00:00Z", "a", "detail_close_escape",
            "search_interface", "special_search");

        assertTrue(predicate.matches(close));
        assertFalse(predicate.matches(automated));
        assertFalse(predicate.matches(otherInterface));
    }

    @Test
    public void testLoadFromStream() throws Exception {
        String yaml = "analyses:\n"
            + "  - name: clicks\n"
            + "    type: funnel\n"
            + "    table: click_aggregates\n"
            + "    cutoff_grace_minutes: 0\n"
            + "    funnels:\n"
            + "      - steps:\n"
            + "          - {name: search_new, action: search_new}\n"
            + "          - {name: result_click, action: result_click}\n";

        List<Analysis> analyses = loader.load(
            new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "inline");

        // without grace the click after midnight is not counted
        List<AggregateTable> tables = analyses.get(0).run(WINDOW, Arrays.asList(
            event("2021-03-10T23:59:00Z", "a", "search_new"),
            event("2021-03-11T00:00:30Z", "a", "result_click")
        ));
        assertEquals(0L, tables.get(0).getRows().get(0).getMetric("num_result_click"));
    }

    @Test
    @Parameters({
        "src/test/resources/config/unknown_type.yaml",
        "src/test/resources/config/unknown_key.yaml",
        "src/test/resources/config/bad_anchor.yaml",
        "src/test/resources/config/duplicate_name.yaml",
        "src/test/resources/config/bad_dimension_step.yaml",
        "src/test/resources/config/negative_grace.yaml",
        "src/test/resources/config/does_not_exist.yaml",
    })
    public void testInvalidDefinitions(String path) {
        try {
            loader.load(new File(path));
        } catch (ConfigLoadingException e) {
            assertNotNull(e.getMessage());
            return;
        }
        throw new AssertionError(path + " should not load");
    }
}
