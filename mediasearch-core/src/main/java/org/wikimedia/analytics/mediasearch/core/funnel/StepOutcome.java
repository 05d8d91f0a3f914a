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
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

import org.wikimedia.analytics.mediasearch.core.Event;

/**
 * Result of evaluating one funnel step for one session: either present,
 * holding the first event that satisfied the step, or absent.
 *
 * Absence is not a zero. Counting completions counts present outcomes,
 * values are only ever read from present ones.
 */
public final class StepOutcome {

    private static final StepOutcome ABSENT = new StepOutcome(null);

    private final Event event;

    private StepOutcome(Event event) {
        this.event = event;
    }

    public static StepOutcome present(Event event) {
        return new StepOutcome(Objects.requireNonNull(event, "a present outcome needs its event"));
    }

    public static StepOutcome absent() {
        return ABSENT;
    }

    public boolean isPresent() {
        return event != null;
    }

    /**
     * @throws NoSuchElementException if the step was not completed
     */
    public Event getEvent() {
        if (event == null) {
            throw new NoSuchElementException("Step was not completed");
        }
        return event;
    }

    /**
     * @throws NoSuchElementException if the step was not completed
     */
    public Instant getTimestamp() {
        return getEvent().getTimestamp();
    }

    /**
     * Numeric attribute of the event that completed the step, for example
     * the position of a clicked result.
     *
     * @return empty when the step was not completed or the attribute is not numeric
     */
    public Optional<Double> getNumericValue(String attribute) {
        return event == null ? Optional.<Double>empty() : Optional.ofNullable(event.getNumericAttribute(attribute));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StepOutcome && Objects.equals(event, ((StepOutcome) o).event);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(event);
    }

    @Override
    public String toString() {
        return event == null ? "Absent" : "Present(" + event.getTimestamp() + ", " + event.getAction() + ")";
    }
}
