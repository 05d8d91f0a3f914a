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

package org.wikimedia.analytics.mediasearch.core.session;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.funnel.EventPredicate;
import org.wikimedia.analytics.mediasearch.core.funnel.FunnelDefinition;

/**
 * Finds the sessions that started on a given day.
 *
 * A session is every event sharing a session id. Its start time is the
 * earliest timestamp among its session start events; sessions without any
 * start event are never reported. Only sessions whose start time falls on
 * the data day (UTC) are kept.
 */
public class SessionExtractor {

    private static final Logger log = Logger.getLogger(SessionExtractor.class.getName());

    private final EventPredicate startPredicate;

    public SessionExtractor(EventPredicate startPredicate) {
        this.startPredicate = Preconditions.checkNotNull(startPredicate, "session start predicate is required");
    }

    /**
     * Uses the first step of the funnel as the session start.
     */
    public SessionExtractor(FunnelDefinition definition) {
        this(definition.getStartStep().getPredicate());
    }

    /**
     * @param events  the scanned events, including the buffer days around dataDay
     * @param dataDay day the sessions must start on
     * @return session id to start time, ordered by start time then session id
     */
    public Map<String, Instant> extract(Iterable<Event> events, LocalDate dataDay) {
        Map<String, Instant> startTimes = new HashMap<>();
        int withoutSession = 0;

        for (Event event : events) {
            if (!startPredicate.matches(event)) {
                continue;
            }
            if (event.getSessionId() == null) {
                withoutSession++;
                continue;
            }
            startTimes.merge(event.getSessionId(), event.getTimestamp(),
                (current, candidate) -> candidate.isBefore(current) ? candidate : current);
        }

        if (withoutSession > 0) {
            log.debug("Ignored " + withoutSession + " session start events without session id");
        }

        List<Map.Entry<String, Instant>> ofInterest = new ArrayList<>();
        for (Map.Entry<String, Instant> entry : startTimes.entrySet()) {
            if (entry.getValue().atZone(ZoneOffset.UTC).toLocalDate().equals(dataDay)) {
                ofInterest.add(entry);
            }
        }
        ofInterest.sort(Map.Entry.<String, Instant>comparingByValue().thenComparing(Map.Entry.comparingByKey()));

        Map<String, Instant> sessions = new LinkedHashMap<>();
        for (Map.Entry<String, Instant> entry : ofInterest) {
            sessions.put(entry.getKey(), entry.getValue());
        }

        log.debug("Found " + sessions.size() + " sessions starting on " + dataDay
            + " out of " + startTimes.size() + " started sessions");
        return sessions;
    }
}
