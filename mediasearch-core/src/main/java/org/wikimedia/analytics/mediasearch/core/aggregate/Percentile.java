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

package org.wikimedia.analytics.mediasearch.core.aggregate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Percentiles of a set of numbers, linearly interpolated between the two
 * closest ranks (the way Hive's percentile function computes them).
 *
 * An empty set has no percentile, groups without values report
 * {@link #EMPTY_SENTINEL} so that each group still gets a row.
 */
public class Percentile {

    public static final double EMPTY_SENTINEL = 0.0;

    private Percentile() {
    }

    public static double median(Collection<? extends Number> values) {
        return of(values, 0.5);
    }

    /**
     * @param values     the numbers, nulls are ignored
     * @param percentile between 0 and 1
     */
    public static double of(Collection<? extends Number> values, double percentile) {
        Preconditions.checkArgument(percentile >= 0.0 && percentile <= 1.0,
            "Percentile %s is not between 0 and 1", percentile);

        List<Double> sorted = new ArrayList<>(values.size());
        for (Number value : values) {
            if (value != null) {
                sorted.add(value.doubleValue());
            }
        }
        if (sorted.isEmpty()) {
            return EMPTY_SENTINEL;
        }
        Collections.sort(sorted);

        double position = (sorted.size() - 1) * percentile;
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted.get(lower);
        }
        double fraction = position - lower;
        return sorted.get(lower) + fraction * (sorted.get(upper) - sorted.get(lower));
    }
}
