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

package org.wikimedia.analytics.mediasearch.core.analysis;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;
import org.wikimedia.analytics.mediasearch.core.aggregate.Aggregator;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicate;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelDefinition;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelMatcher;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelStep;
import org.wikimedia.analytics.mediasearch.core.funnel.SessionFunnel;
import org.wikimedia.analytics.mediasearch.core.session.SessionExtractor;

/**
 * Filter usage of search sessions started on the data day:
 * <ul>
 *   <li>the number of changes per filter type and value, a cleared filter
 *       being counted as "reset";</li>
 *   <li>the number of sessions that used each filter type.</li>
 * </ul>
 */
public class FilterUsageAnalysis implements Analysis {

    private static final Logger log = Logger.getLogger(FilterUsageAnalysis.class.getName());

    public static final String START_STEP = "search_start";
    public static final String FILTER_STEP = "filter_change";
    public static final String CHANGES_METRIC = "num_changes";

    private final String name;
    private final FunnelDefinition definition;
    private final String typeAttribute;
    private final String valueAttribute;
    private final String changeTable;
    private final String sessionTable;
    private final Duration cutoffGrace;

    public FilterUsageAnalysis(String name, EventPredicate sessionStart, EventPredicate filterChange,
                               String typeAttribute, String valueAttribute,
                               String changeTable, String sessionTable, Duration cutoffGrace) {
        this.name = name;
        this.definition = new FunnelDefinition(name, Arrays.asList(
            FunnelStep.required(START_STEP, sessionStart),
            FunnelStep.branch(FILTER_STEP, filterChange, START_STEP)
        ));
        this.typeAttribute = typeAttribute;
        this.valueAttribute = valueAttribute;
        this.changeTable = changeTable;
        this.sessionTable = sessionTable;
        this.cutoffGrace = cutoffGrace;
    }

    @Override
    public String getName() {
        return name;
    }

    public FunnelDefinition getDefinition() {
        return definition;
    }

    @Override
    public List<AggregateTable> run(RunWindow window, List<Event> events) {
        LocalDate dataDay = window.getDataDay();
        Map<String, Instant> sessions = new SessionExtractor(definition).extract(events, dataDay);
        List<SessionFunnel> funnels = new FunnelMatcher(definition, cutoffGrace).match(sessions, events, dataDay);

        EventPredicate isFilterChange = definition.getStep(1).getPredicate();
        List<Event> changes = new ArrayList<>();
        for (SessionFunnel funnel : funnels) {
            for (Event event : funnel.getEvents()) {
                if (isFilterChange.matches(event)) {
                    changes.add(event);
                }
            }
        }
        log.info(name + ": " + changes.size() + " filter changes in " + sessions.size() + " sessions on " + dataDay);

        Aggregator aggregator = new Aggregator(dataDay);
        List<AggregateTable> tables = new ArrayList<>();
        tables.add(aggregator.categoryCounts(changeTable, changes, typeAttribute, valueAttribute, CHANGES_METRIC));
        tables.add(aggregator.sessionsPerCategory(sessionTable, funnels, isFilterChange, typeAttribute,
            Aggregator.SESSIONS_METRIC));
        return tables;
    }
}
