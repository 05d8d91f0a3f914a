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

package org.wikimedia.analytics.mediasearch.hive;

import org.wikimedia.analytics.mediasearch.core.partition.MonthDayRange;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionDisjunction;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;

/**
 * Renders a partition predicate as a HiveQL boolean expression, ready to be
 * combined with other conditions in a WHERE clause:
 *
 *   (e.year = 2021 AND e.month = 3 AND e.day BETWEEN 5 AND 7)
 *   ((e.year = 2021 AND e.month = 2 AND e.day >= 28) OR (e.year = 2021 AND e.month = 3 AND e.day <= 1))
 */
public class HivePartitionPredicateRenderer implements PartitionPredicate.Visitor<String> {

    private static final HivePartitionPredicateRenderer INSTANCE = new HivePartitionPredicateRenderer();

    public static String render(PartitionPredicate predicate) {
        return predicate.accept(INSTANCE);
    }

    @Override
    public String visitRange(MonthDayRange range) {
        StringBuilder sb = new StringBuilder("(");
        sb.append(range.qualify(PartitionPredicate.YEAR_COLUMN)).append(" = ").append(range.getYear());
        sb.append(" AND ").append(range.qualify(PartitionPredicate.MONTH_COLUMN)).append(" = ").append(range.getMonth());
        String day = range.qualify(PartitionPredicate.DAY_COLUMN);
        if (range.getFirstDay() != null && range.getLastDay() != null) {
            sb.append(" AND ").append(day).append(" BETWEEN ").append(range.getFirstDay())
                .append(" AND ").append(range.getLastDay());
        } else if (range.getFirstDay() != null) {
            sb.append(" AND ").append(day).append(" >= ").append(range.getFirstDay());
        } else {
            sb.append(" AND ").append(day).append(" <= ").append(range.getLastDay());
        }
        return sb.append(")").toString();
    }

    @Override
    public String visitDisjunction(PartitionDisjunction disjunction) {
        StringBuilder sb = new StringBuilder("(");
        for (MonthDayRange range : disjunction.getRanges()) {
            if (sb.length() > 1) {
                sb.append(" OR ");
            }
            sb.append(visitRange(range));
        }
        return sb.append(")").toString();
    }
}
