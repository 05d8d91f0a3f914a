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

package org.wikimedia.analytics.mediasearch.core.partition;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Coarse time bucket (year, month, day) an event was ingested into.
 * Only used to prune scans, it can differ from the event's own timestamp
 * by the ingestion lag.
 */
public final class PartitionKey implements Comparable<PartitionKey> {

    private final int year;
    private final int month;
    private final int day;

    public PartitionKey(int year, int month, int day) {
        this.year = year;
        this.month = month;
        this.day = day;
    }

    public static PartitionKey of(LocalDate date) {
        return new PartitionKey(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * Partition an event would land in if it had no ingestion lag.
     */
    public static PartitionKey fromTimestamp(Instant timestamp) {
        return of(timestamp.atZone(ZoneOffset.UTC).toLocalDate());
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    public LocalDate toLocalDate() {
        return LocalDate.of(year, month, day);
    }

    @Override
    public int compareTo(PartitionKey other) {
        int result = Integer.compare(year, other.year);
        if (result == 0) {
            result = Integer.compare(month, other.month);
        }
        if (result == 0) {
            result = Integer.compare(day, other.day);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PartitionKey)) {
            return false;
        }
        PartitionKey that = (PartitionKey) o;
        return year == that.year && month == that.month && day == that.day;
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day);
    }

    @Override
    public String toString() {
        return "year=" + year + "/month=" + month + "/day=" + day;
    }
}
