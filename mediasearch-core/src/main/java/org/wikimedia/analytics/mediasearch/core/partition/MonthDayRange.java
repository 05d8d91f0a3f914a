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

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Preconditions;

/**
 * Days of a single month: year = Y AND month = M AND a day bound.
 * Either day bound can be open (null), in which case the range extends
 * to the start or the end of the month.
 */
public final class MonthDayRange extends PartitionPredicate {

    private final int year;
    private final int month;
    private final Integer firstDay;
    private final Integer lastDay;

    public MonthDayRange(String alias, int year, int month, Integer firstDay, Integer lastDay) {
        super(alias);
        Preconditions.checkArgument(month >= 1 && month <= 12, "Invalid month %s", month);
        Preconditions.checkArgument(firstDay != null || lastDay != null,
            "A month day range needs at least one day bound");
        if (firstDay != null && lastDay != null) {
            Preconditions.checkArgument(firstDay <= lastDay,
                "First day %s is after last day %s", firstDay, lastDay);
        }
        this.year = year;
        this.month = month;
        this.firstDay = firstDay;
        this.lastDay = lastDay;
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    /**
     * @return the inclusive lower day bound, null if open
     */
    public Integer getFirstDay() {
        return firstDay;
    }

    /**
     * @return the inclusive upper day bound, null if open
     */
    public Integer getLastDay() {
        return lastDay;
    }

    public boolean isBounded() {
        return firstDay != null && lastDay != null;
    }

    @Override
    public boolean matches(PartitionKey key) {
        return key.getYear() == year
            && key.getMonth() == month
            && (firstDay == null || key.getDay() >= firstDay)
            && (lastDay == null || key.getDay() <= lastDay);
    }

    @Override
    public List<PartitionKey> partitions() {
        int from = firstDay == null ? 1 : firstDay;
        int to = lastDay == null ? YearMonth.of(year, month).lengthOfMonth() : lastDay;
        List<PartitionKey> keys = new ArrayList<>();
        for (int day = from; day <= to; day++) {
            keys.add(new PartitionKey(year, month, day));
        }
        return keys;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MonthDayRange)) {
            return false;
        }
        MonthDayRange that = (MonthDayRange) o;
        return year == that.year
            && month == that.month
            && Objects.equals(firstDay, that.firstDay)
            && Objects.equals(lastDay, that.lastDay)
            && Objects.equals(getAlias(), that.getAlias());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getAlias(), year, month, firstDay, lastDay);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(qualify(YEAR_COLUMN)).append(" = ").append(year)
            .append(" AND ").append(qualify(MONTH_COLUMN)).append(" = ").append(month)
            .append(" AND ").append(qualify(DAY_COLUMN));
        if (isBounded()) {
            sb.append(" BETWEEN ").append(firstDay).append(" AND ").append(lastDay);
        } else if (firstDay != null) {
            sb.append(" >= ").append(firstDay);
        } else {
            sb.append(" <= ").append(lastDay);
        }
        return sb.toString();
    }
}
