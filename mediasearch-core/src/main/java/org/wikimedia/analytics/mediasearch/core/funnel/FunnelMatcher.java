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

package org.wikimedia.analytics.mediasearch.core.funnel;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.RunWindow;

/**
 * Evaluates a funnel definition against the sessions of interest of a day.
 *
 * Events of a session are only considered from the session start time
 * (inclusive) to the cutoff time (exclusive). For each step the first
 * matching event counts as the step occurrence:
 * <ul>
 *   <li>the start step occurs at the session start time;</li>
 *   <li>a required step is looked for at or after the previous required
 *       step, and once one is missed all later required steps are absent;</li>
 *   <li>a branch step is looked for at or after its anchor step, and is
 *       absent when its anchor is.</li>
 * </ul>
 * Ordering is non-strict: an event with the same timestamp as the previous
 * step can complete the next one.
 */
public class FunnelMatcher {

    private static final Logger log = Logger.getLogger(FunnelMatcher.class.getName());

    private static final Comparator<Event> BY_TIMESTAMP = Comparator.comparing(Event::getTimestamp);

    private final FunnelDefinition definition;
    private final Duration cutoffGrace;

    public FunnelMatcher(FunnelDefinition definition) {
        this(definition, RunWindow.DEFAULT_CUTOFF_GRACE);
    }

    public FunnelMatcher(FunnelDefinition definition, Duration cutoffGrace) {
        this.definition = Preconditions.checkNotNull(definition, "funnel definition is required");
        this.cutoffGrace = Preconditions.checkNotNull(cutoffGrace, "cutoff grace is required");
    }

    public FunnelDefinition getDefinition() {
        return definition;
    }

    /**
     * @param sessions session id to start time, as given by the SessionExtractor
     * @param events   every event of the scanned window
     * @param dataDay  day the sessions started on
     * @return one result per session, ordered by start time then session id
     */
    public List<SessionFunnel> match(Map<String, Instant> sessions, Iterable<Event> events, LocalDate dataDay) {
        Instant cutoff = RunWindow.forDataDay(dataDay).getCutoffTime(cutoffGrace);

        Map<String, List<Event>> sessionEvents = new HashMap<>();
        for (Event event : events) {
            Instant start = event.getSessionId() == null ? null : sessions.get(event.getSessionId());
            if (start == null) {
                continue;
            }
            Instant timestamp = event.getTimestamp();
            if (timestamp.isBefore(start) || !timestamp.isBefore(cutoff)) {
                continue;
            }
            sessionEvents.computeIfAbsent(event.getSessionId(), id -> new ArrayList<>()).add(event);
        }

        List<Map.Entry<String, Instant>> ordered = new ArrayList<>(sessions.entrySet());
        ordered.sort(Map.Entry.<String, Instant>comparingByValue().thenComparing(Map.Entry.comparingByKey()));

        List<SessionFunnel> results = new ArrayList<>(ordered.size());
        for (Map.Entry<String, Instant> session : ordered) {
            List<Event> windowed = sessionEvents.getOrDefault(session.getKey(), Collections.<Event>emptyList());
            // List.sort is stable, events sharing a timestamp keep their log order
            windowed.sort(BY_TIMESTAMP);

            List<StepOutcome> outcomes = evaluate(session.getValue(), windowed);
            results.add(new SessionFunnel(session.getKey(), session.getValue(), definition, outcomes, windowed));
            if (log.isDebugEnabled()) {
                log.debug("Session " + session.getKey() + " of " + definition.getName() + ": " + outcomes);
            }
        }
        return results;
    }

    /**
     * Evaluates the steps against the time ordered events of one session.
     */
    List<StepOutcome> evaluate(Instant startTime, List<Event> events) {
        List<StepOutcome> outcomes = new ArrayList<>(definition.size());
        outcomes.add(firstMatch(definition.getStartStep().getPredicate(), events, startTime));

        Instant chainTime = startTime;
        boolean chainBroken = !outcomes.get(0).isPresent();

        for (int i = 1; i < definition.size(); i++) {
            FunnelStep step = definition.getStep(i);
            StepOutcome outcome;
            if (step.isRequired()) {
                if (chainBroken) {
                    outcome = StepOutcome.absent();
                } else {
                    outcome = firstMatch(step.getPredicate(), events, chainTime);
                    if (outcome.isPresent()) {
                        chainTime = outcome.getTimestamp();
                    } else {
                        chainBroken = true;
                    }
                }
            } else {
                StepOutcome anchor = outcomes.get(definition.indexOf(step.getAnchor()));
                outcome = anchor.isPresent()
                    ? firstMatch(step.getPredicate(), events, anchor.getTimestamp())
                    : StepOutcome.absent();
            }
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private static StepOutcome firstMatch(EventPredicate predicate, List<Event> events, Instant notBefore) {
        for (Event event : events) {
            if (!event.getTimestamp().isBefore(notBefore) && predicate.matches(event)) {
                return StepOutcome.present(event);
            }
        }
        return StepOutcome.absent();
    }
}
