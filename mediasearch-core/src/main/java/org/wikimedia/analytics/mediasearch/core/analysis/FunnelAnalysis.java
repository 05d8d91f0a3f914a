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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;
import org.wikimedia.analytics.mediasearch.core.aggregate.Aggregator;
import org.wikimedia.analytics.mediasearch.core.aggregate.SessionDimension;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelDefinition;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelMatcher;
import org.wikimedia.analytics.mediasearch.core.funnel.SessionFunnel;
import org.wikimedia.analytics.mediasearch.core.session.SessionExtractor;

/**
 * Step completion counts of a funnel, optionally with click position
 * statistics for one of its steps.
 *
 * A funnel can have several variants (add media, edit media) sharing their
 * step names. Each variant finds its own sessions, the counts of all
 * variants go to the same table.
 */
public class FunnelAnalysis implements Analysis {

    private static final Logger log = Logger.getLogger(FunnelAnalysis.class.getName());

    private final String name;
    private final String table;
    private final List<FunnelDefinition> variants;
    private final List<SessionDimension> dimensions;
    private final Duration cutoffGrace;
    private final ClickPositions clickPositions;

    public FunnelAnalysis(String name, String table, List<FunnelDefinition> variants,
                          List<SessionDimension> dimensions, Duration cutoffGrace, ClickPositions clickPositions) {
        Preconditions.checkArgument(!variants.isEmpty(), "Analysis %s has no funnel", name);
        List<String> stepNames = variants.get(0).getStepNames();
        for (FunnelDefinition variant : variants) {
            Preconditions.checkArgument(variant.getStepNames().equals(stepNames),
                "Variants of analysis %s must share their steps, %s has %s instead of %s",
                name, variant.getVariant(), variant.getStepNames(), stepNames);
        }
        for (SessionDimension dimension : dimensions) {
            Preconditions.checkArgument(dimension.getStepName() == null || stepNames.contains(dimension.getStepName()),
                "Analysis %s has no step %s for dimension %s", name, dimension.getStepName(), dimension.getColumn());
        }
        Preconditions.checkArgument(!cutoffGrace.isNegative(), "Analysis %s has a negative cutoff grace", name);
        if (clickPositions != null) {
            Preconditions.checkArgument(stepNames.contains(clickPositions.getStep()),
                "Analysis %s has no step %s for click positions", name, clickPositions.getStep());
        }
        this.name = name;
        this.table = table;
        this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
        this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        this.cutoffGrace = cutoffGrace;
        this.clickPositions = clickPositions;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getTable() {
        return table;
    }

    public List<FunnelDefinition> getVariants() {
        return variants;
    }

    public List<SessionDimension> getDimensions() {
        return dimensions;
    }

    public ClickPositions getClickPositions() {
        return clickPositions;
    }

    @Override
    public List<AggregateTable> run(RunWindow window, List<Event> events) {
        LocalDate dataDay = window.getDataDay();

        List<SessionFunnel> funnels = new ArrayList<>();
        for (FunnelDefinition variant : variants) {
            Map<String, Instant> sessions = new SessionExtractor(variant).extract(events, dataDay);
            funnels.addAll(new FunnelMatcher(variant, cutoffGrace).match(sessions, events, dataDay));
            log.info(name + (variant.getVariant() == null ? "" : "/" + variant.getVariant())
                + ": " + sessions.size() + " sessions on " + dataDay);
        }

        Aggregator aggregator = new Aggregator(dataDay);
        List<AggregateTable> tables = new ArrayList<>();
        tables.add(aggregator.stepCounts(table, variants.get(0).getStepNames(), funnels, dimensions));
        if (clickPositions != null) {
            tables.add(aggregator.clickPositions(clickPositions.getTable(), funnels,
                clickPositions.getStep(), clickPositions.getPositionAttribute(), dimensions));
        }
        return tables;
    }

    /**
     * Where and from which step to compute click position statistics.
     */
    public static final class ClickPositions {
        private final String table;
        private final String step;
        private final String positionAttribute;

        public ClickPositions(String table, String step, String positionAttribute) {
            this.table = table;
            this.step = step;
            this.positionAttribute = positionAttribute;
        }

        public String getTable() {
            return table;
        }

        public String getStep() {
            return step;
        }

        public String getPositionAttribute() {
            return positionAttribute;
        }
    }
}
