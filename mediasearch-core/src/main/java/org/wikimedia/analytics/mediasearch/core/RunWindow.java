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

package org.wikimedia.analytics.mediasearch.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

import com.google.common.base.Preconditions;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionRangeSelector;

/**
 * Time frame of one daily run.
 *
 * The data day is the day whose sessions are aggregated. Sessions can start
 * close to midnight and their events can be ingested into a neighbouring
 * partition, so scans cover one extra day on each side. Events count towards
 * a session until the cutoff: midnight after the data day plus a grace
 * period (one hour by default). All computations are in UTC.
 */
public final class RunWindow {

    public static final Duration DEFAULT_CUTOFF_GRACE = Duration.ofHours(1);

    private final LocalDate dataDay;

    private RunWindow(LocalDate dataDay) {
        this.dataDay = Preconditions.checkNotNull(dataDay, "data day is required");
    }

    public static RunWindow forDataDay(LocalDate dataDay) {
        return new RunWindow(dataDay);
    }

    /**
     * The window for a scheduled run: data day is yesterday, in UTC.
     */
    public static RunWindow fromClock(Clock clock) {
        return new RunWindow(LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1));
    }

    public LocalDate getDataDay() {
        return dataDay;
    }

    public LocalDate getScanStart() {
        return dataDay.minusDays(1);
    }

    public LocalDate getScanEnd() {
        return dataDay.plusDays(1);
    }

    public Instant getDayStart() {
        return dataDay.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant getCutoffTime() {
        return getCutoffTime(DEFAULT_CUTOFF_GRACE);
    }

    /**
     * @param grace time allowed after midnight for sessions to complete
     * @return the exclusive upper bound for event timestamps
     */
    public Instant getCutoffTime(Duration grace) {
        Preconditions.checkArgument(!grace.isNegative(), "Cutoff grace can not be negative");
        return dataDay.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().plus(grace);
    }

    public PartitionPredicate getScanPredicate() {
        return getScanPredicate(null);
    }

    public PartitionPredicate getScanPredicate(String alias) {
        return PartitionRangeSelector.select(getScanStart(), getScanEnd(), alias);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RunWindow && dataDay.equals(((RunWindow) o).dataDay);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataDay);
    }

    @Override
    public String toString() {
        return "RunWindow{dataDay=" + dataDay + ", scan=" + getScanStart() + ".." + getScanEnd() + '}';
    }
}
