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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;

/**
 * Union of month scoped ranges, used when a day window crosses a month
 * boundary.
 */
public final class PartitionDisjunction extends PartitionPredicate {

    private final List<MonthDayRange> ranges;

    public PartitionDisjunction(String alias, List<MonthDayRange> ranges) {
        super(alias);
        Preconditions.checkArgument(ranges.size() >= 2, "A disjunction needs at least two ranges");
        this.ranges = Collections.unmodifiableList(new ArrayList<>(ranges));
    }

    public List<MonthDayRange> getRanges() {
        return ranges;
    }

    @Override
    public boolean matches(PartitionKey key) {
        for (MonthDayRange range : ranges) {
            if (range.matches(key)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public List<PartitionKey> partitions() {
        List<PartitionKey> keys = new ArrayList<>();
        for (MonthDayRange range : ranges) {
            keys.addAll(range.partitions());
        }
        Collections.sort(keys);
        return keys;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDisjunction(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PartitionDisjunction)) {
            return false;
        }
        PartitionDisjunction that = (PartitionDisjunction) o;
        return ranges.equals(that.ranges) && Objects.equals(getAlias(), that.getAlias());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getAlias(), ranges);
    }

    @Override
    public String toString() {
        return "(" + Joiner.on(") OR (").join(ranges) + ")";
    }
}
