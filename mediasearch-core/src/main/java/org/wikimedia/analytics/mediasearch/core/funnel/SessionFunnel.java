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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import org.wikimedia.analytics.mediasearch.core.Event;

/**
 * Step outcomes of one session of interest, in the order of its funnel
 * definition, along with the session events that were inside the window.
 */
public final class SessionFunnel {

    private final String sessionId;
    private final Instant startTime;
    private final FunnelDefinition definition;
    private final List<StepOutcome> outcomes;
    private final List<Event> events;

    public SessionFunnel(String sessionId, Instant startTime, FunnelDefinition definition,
                         List<StepOutcome> outcomes, List<Event> events) {
        Preconditions.checkArgument(outcomes.size() == definition.size(),
            "Session %s has %s outcomes for %s steps", sessionId, outcomes.size(), definition.size());
        this.sessionId = sessionId;
        this.startTime = startTime;
        this.definition = definition;
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    public String getSessionId() {
        return sessionId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public FunnelDefinition getDefinition() {
        return definition;
    }

    public List<StepOutcome> getOutcomes() {
        return outcomes;
    }

    public StepOutcome getOutcome(int stepIndex) {
        return outcomes.get(stepIndex);
    }

    /**
     * @throws IllegalArgumentException if the funnel has no such step
     */
    public StepOutcome getOutcome(String stepName) {
        int index = definition.indexOf(stepName);
        Preconditions.checkArgument(index >= 0, "Funnel %s has no step %s", definition.getName(), stepName);
        return outcomes.get(index);
    }

    public boolean isCompleted(int stepIndex) {
        return outcomes.get(stepIndex).isPresent();
    }

    /**
     * @return events of the session between its start and the cutoff, by time
     */
    public List<Event> getEvents() {
        return events;
    }

    @Override
    public String toString() {
        return "SessionFunnel{" + sessionId + " @" + startTime + ", outcomes=" + outcomes + '}';
    }
}
