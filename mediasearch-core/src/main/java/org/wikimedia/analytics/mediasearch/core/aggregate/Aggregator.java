/**
 * Copyright (C) 2020  Wikimedia Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.wikimedia.analytics.mediasearch.core.aggregate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicate;
import org.wikimedia.analytics.mediasearch.core.funnel.SessionFunnel;

/**
 * Reduces per session funnel results of one log date into aggregate rows.
 *
 * Rows come out sorted by their dimension values. A table without
 * dimensions always has exactly one row, even when there was no session.
 */
public class Aggregator {

    private static final Logger log = Logger.getLogger(Aggregator.class.getName());

    public static final String STEP_METRIC_PREFIX = "num_";

    public static final String SESSIONS_METRIC = "num_sessions";
    public static final String CLICK_SESSIONS_METRIC = "num_click_sessions";
    public static final String CLICKS_METRIC = "num_clicks";
    public static final String MEDIAN_POSITION_METRIC = "median_position";

    private static final Comparator<List<String>> KEY_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int result = a.get(i).compareTo(b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private final LocalDate logDate;

    public Aggregator(LocalDate logDate) {
        this.logDate = Preconditions.checkNotNull(logDate, "log date is required");
    }

    public LocalDate getLogDate() {
        return logDate;
    }

    public static String stepMetric(String stepName) {
        return STEP_METRIC_PREFIX + stepName;
    }

    /**
     * Counts, for each step, the sessions where the step is present.
     * Sessions missing a step do not add to its count.
     *
     * @param stepNames  steps to count, all funnels must define them
     * @param funnels    matched sessions, possibly from several variants of a funnel
     * @param dimensions session dimensions to group by
     */
    public AggregateTable stepCounts(String table, List<String> stepNames, List<SessionFunnel> funnels,
                                     List<SessionDimension> dimensions) {
        Map<List<String>, long[]> groups = seedGroups(dimensions, stepNames.size());

        for (SessionFunnel funnel : funnels) {
            long[] counts = groups.computeIfAbsent(keyOf(funnel, dimensions), k -> new long[stepNames.size()]);
            for (int i = 0; i < stepNames.size(); i++) {
                if (funnel.getOutcome(stepNames.get(i)).isPresent()) {
                    counts[i]++;
                }
            }
        }

        List<String> metricColumns = new ArrayList<>(stepNames.size());
        for (String stepName : stepNames) {
            metricColumns.add(stepMetric(stepName));
        }

        List<AggregateRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<String>, long[]> group : groups.entrySet()) {
            Map<String, Number> metrics = new LinkedHashMap<>();
            for (int i = 0; i < metricColumns.size(); i++) {
                metrics.put(metricColumns.get(i), group.getValue()[i]);
            }
            rows.add(new AggregateRow(logDate, dimensionValues(dimensions, group.getKey()), metrics));
        }
        return table(table, columnsOf(dimensions), metricColumns, rows);
    }

    /**
     * Counts the (type, value) pairs of the given events. Blank values are
     * counted under {@link CategoryNormalizer#RESET_LABEL}, events without a
     * type are skipped. The attribute names are used as column names.
     */
    public AggregateTable categoryCounts(String table, Iterable<Event> events, String typeAttribute,
                                         String valueAttribute, String metricColumn) {
        Map<List<String>, long[]> groups = new TreeMap<>(KEY_ORDER);
        int withoutType = 0;

        for (Event event : events) {
            String type = event.getStringAttribute(typeAttribute);
            if (type == null || type.isEmpty()) {
                withoutType++;
                continue;
            }
            String value = CategoryNormalizer.normalize(event.getAttribute(valueAttribute));
            groups.computeIfAbsent(listOf(type, value), k -> new long[1])[0]++;
        }

        if (withoutType > 0) {
            log.warn(table + ": skipped " + withoutType + " events without " + typeAttribute);
        }

        List<AggregateRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<String>, long[]> group : groups.entrySet()) {
            Map<String, String> dimensions = new LinkedHashMap<>();
            dimensions.put(typeAttribute, group.getKey().get(0));
            dimensions.put(valueAttribute, group.getKey().get(1));
            rows.add(new AggregateRow(logDate, dimensions, singleMetric(metricColumn, group.getValue()[0])));
        }
        return table(table, listOf(typeAttribute, valueAttribute), Collections.singletonList(metricColumn), rows);
    }

    /**
     * Counts, for each type, the sessions with at least one matching event
     * of that type.
     */
    public AggregateTable sessionsPerCategory(String table, List<SessionFunnel> funnels, EventPredicate eventFilter,
                                              String typeAttribute, String metricColumn) {
        Map<List<String>, long[]> groups = new TreeMap<>(KEY_ORDER);

        for (SessionFunnel funnel : funnels) {
            Set<String> types = new HashSet<>();
            for (Event event : funnel.getEvents()) {
                String type = event.getStringAttribute(typeAttribute);
                if (type != null && !type.isEmpty() && eventFilter.matches(event)) {
                    types.add(type);
                }
            }
            for (String type : types) {
                groups.computeIfAbsent(Collections.singletonList(type), k -> new long[1])[0]++;
            }
        }

        List<AggregateRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<String>, long[]> group : groups.entrySet()) {
            Map<String, String> dimensions = new LinkedHashMap<>();
            dimensions.put(typeAttribute, group.getKey().get(0));
            rows.add(new AggregateRow(logDate, dimensions, singleMetric(metricColumn, group.getValue()[0])));
        }
        return table(table, Collections.singletonList(typeAttribute), Collections.singletonList(metricColumn), rows);
    }

    /**
     * Click-through statistics: sessions, sessions where the click step is
     * present, every click event in the session windows, and the median of
     * the click positions ({@link Percentile#EMPTY_SENTINEL} without clicks).
     */
    public AggregateTable clickPositions(String table, List<SessionFunnel> funnels, String clickStep,
                                         String positionAttribute, List<SessionDimension> dimensions) {
        Map<List<String>, ClickGroup> groups = new TreeMap<>(KEY_ORDER);
        for (List<String> key : seedGroups(dimensions, 0).keySet()) {
            groups.put(key, new ClickGroup());
        }

        for (SessionFunnel funnel : funnels) {
            ClickGroup group = groups.computeIfAbsent(keyOf(funnel, dimensions), k -> new ClickGroup());
            group.sessions++;
            if (funnel.getOutcome(clickStep).isPresent()) {
                group.clickSessions++;
            }
            EventPredicate isClick = funnel.getDefinition().getStep(funnel.getDefinition().indexOf(clickStep))
                .getPredicate();
            for (Event event : funnel.getEvents()) {
                if (isClick.matches(event)) {
                    group.clicks++;
                    Double position = event.getNumericAttribute(positionAttribute);
                    if (position != null) {
                        group.positions.add(position);
                    }
                }
            }
        }

        List<String> metricColumns = listOf(SESSIONS_METRIC, CLICK_SESSIONS_METRIC, CLICKS_METRIC,
            MEDIAN_POSITION_METRIC);
        List<AggregateRow> rows = new ArrayList<>(groups.size());
        for (Map.Entry<List<String>, ClickGroup> entry : groups.entrySet()) {
            ClickGroup group = entry.getValue();
            Map<String, Number> metrics = new LinkedHashMap<>();
            metrics.put(SESSIONS_METRIC, group.sessions);
            metrics.put(CLICK_SESSIONS_METRIC, group.clickSessions);
            metrics.put(CLICKS_METRIC, group.clicks);
            metrics.put(MEDIAN_POSITION_METRIC, Percentile.median(group.positions));
            rows.add(new AggregateRow(logDate, dimensionValues(dimensions, entry.getKey()), metrics));
        }
        return table(table, columnsOf(dimensions), metricColumns, rows);
    }

    private static final class ClickGroup {
        private long sessions;
        private long clickSessions;
        private long clicks;
        private final List<Double> positions = new ArrayList<>();
    }

    /**
     * Every combination of declared dimension values, with zeroed counters.
     * Nothing is seeded if a dimension declares no values; without
     * dimensions the single empty key is.
     */
    private static Map<List<String>, long[]> seedGroups(List<SessionDimension> dimensions, int metricCount) {
        Map<List<String>, long[]> groups = new TreeMap<>(KEY_ORDER);
        List<List<String>> keys = new ArrayList<>();
        keys.add(Collections.<String>emptyList());
        for (SessionDimension dimension : dimensions) {
            List<List<String>> extended = new ArrayList<>();
            for (List<String> key : keys) {
                for (String value : dimension.getDeclaredValues()) {
                    List<String> longer = new ArrayList<>(key);
                    longer.add(value);
                    extended.add(longer);
                }
            }
            keys = extended;
        }
        for (List<String> key : keys) {
            groups.put(key, new long[metricCount]);
        }
        return groups;
    }

    private static List<String> keyOf(SessionFunnel funnel, List<SessionDimension> dimensions) {
        List<String> key = new ArrayList<>(dimensions.size());
        for (SessionDimension dimension : dimensions) {
            key.add(dimension.valueFor(funnel));
        }
        return key;
    }

    private static Map<String, String> dimensionValues(List<SessionDimension> dimensions, List<String> key) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            values.put(dimensions.get(i).getColumn(), key.get(i));
        }
        return values;
    }

    private static List<String> columnsOf(List<SessionDimension> dimensions) {
        List<String> columns = new ArrayList<>(dimensions.size());
        for (SessionDimension dimension : dimensions) {
            columns.add(dimension.getColumn());
        }
        return columns;
    }

    private static Map<String, Number> singleMetric(String column, long value) {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put(column, value);
        return metrics;
    }

    private static List<String> listOf(String... values) {
        List<String> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return list;
    }

    private AggregateTable table(String name, List<String> dimensionColumns, List<String> metricColumns,
                                 List<AggregateRow> rows) {
        log.info(name + ": " + rows.size() + " rows for " + logDate);
        return new AggregateTable(name, logDate, dimensionColumns, metricColumns, rows);
    }
}
