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

import java.util.List;

/**
 * Structured filter over the (year, month, day) partition columns of an
 * event log.
 *
 * A predicate is advisory: it exists to keep a scan away from partitions
 * that cannot hold relevant data, it never decides which events are used.
 * Execution adapters render it into their own query language through a
 * {@link Visitor}; in-memory sources call {@link #matches(PartitionKey)}.
 *
 * The optional alias qualifies the partition columns when the predicate is
 * applied to one of several joined sources.
 */
public abstract class PartitionPredicate {

    public static final String YEAR_COLUMN = "year";
    public static final String MONTH_COLUMN = "month";
    public static final String DAY_COLUMN = "day";

    private final String alias;

    protected PartitionPredicate(String alias) {
        this.alias = alias;
    }

    /**
     * @return the source alias, or null when columns are unqualified
     */
    public String getAlias() {
        return alias;
    }

    /**
     * @param column one of the partition column names
     * @return the column name, prefixed with the alias if there is one
     */
    public String qualify(String column) {
        return alias == null ? column : alias + "." + column;
    }

    public abstract boolean matches(PartitionKey key);

    /**
     * Lists every day partition this predicate lets through, in order.
     */
    public abstract List<PartitionKey> partitions();

    public abstract <T> T accept(Visitor<T> visitor);

    public interface Visitor<T> {
        T visitRange(MonthDayRange range);

        T visitDisjunction(PartitionDisjunction disjunction);
    }
}
