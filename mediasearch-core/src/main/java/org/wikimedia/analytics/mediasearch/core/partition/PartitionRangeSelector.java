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

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Turns an inclusive [start, end] day window into a partition predicate.
 *
 * Windows are expected to stay within one month or span two adjacent
 * months (the daily jobs scan three days at most):
 * <ul>
 *   <li>same month: year = Y AND month = M AND day BETWEEN D1 AND D2</li>
 *   <li>adjacent months: (year = Y1 AND month = M1 AND day >= D1)
 *       OR (year = Y2 AND month = M2 AND day <= D2)</li>
 * </ul>
 */
public class PartitionRangeSelector {

    private PartitionRangeSelector() {
    }

    public static PartitionPredicate select(LocalDate start, LocalDate end) {
        return select(start, end, null);
    }

    /**
     * @param start first day, inclusive
     * @param end   last day, inclusive
     * @param alias source alias qualifying the partition columns, may be null
     * @return the narrowest predicate covering every partition of the window
     */
    public static PartitionPredicate select(LocalDate start, LocalDate end, String alias) {
        Preconditions.checkNotNull(start, "start day is required");
        Preconditions.checkNotNull(end, "end day is required");
        Preconditions.checkArgument(!end.isBefore(start),
            "End day %s is before start day %s", end, start);

        YearMonth startMonth = YearMonth.from(start);
        YearMonth endMonth = YearMonth.from(end);

        if (startMonth.equals(endMonth)) {
            return new MonthDayRange(alias, start.getYear(), start.getMonthValue(),
                start.getDayOfMonth(), end.getDayOfMonth());
        }

        Preconditions.checkArgument(startMonth.plusMonths(1).equals(endMonth),
            "Days %s and %s are neither in the same nor in adjacent months", start, end);

        return new PartitionDisjunction(alias, Arrays.asList(
            new MonthDayRange(alias, start.getYear(), start.getMonthValue(), start.getDayOfMonth(), null),
            new MonthDayRange(alias, end.getYear(), end.getMonthValue(), null, end.getDayOfMonth())
        ));
    }
}
