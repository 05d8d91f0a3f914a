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

import java.util.ArrayList;
import java.util.List;

import org.apache.hadoop.hive.ql.exec.Description;
import org.apache.hadoop.hive.ql.exec.UDAF;
import org.apache.hadoop.hive.ql.exec.UDAFEvaluator;
import org.wikimedia.analytics.mediasearch.core.aggregate.Percentile;

/**
 * Computes the median of a numeric column, for example the median position
 * of clicked search results.
 *
 * Example of use:
 *     SELECT search_interface, MEDIAN(position) FROM clicks GROUP BY search_interface;
 *
 * Values are linearly interpolated between the two middle values when their
 * count is even. NULL values are ignored. Without values 0.0 is returned,
 * not NULL, so that empty groups still report a number.
 */
@Description(
    name = "median",
    value = "_FUNC_(x) - Returns the median of x, 0.0 if there is no value.")
public class MedianUDAF extends UDAF {

    public static class MedianUDAFState {
        private List<Double> values;
    }

    public static class MedianUDAFEvaluator implements UDAFEvaluator {
        private MedianUDAFState state;

        public MedianUDAFEvaluator() {
            super();
            state = new MedianUDAFState();
            init();
        }

        public void init() {
            state.values = new ArrayList<>();
        }

        public boolean iterate(Double value) {
            if (value != null) {
                state.values.add(value);
            }
            return true;
        }

        public MedianUDAFState terminatePartial() {
            return state;
        }

        public boolean merge(MedianUDAFState other) {
            if (other != null && other.values != null) {
                state.values.addAll(other.values);
            }
            return true;
        }

        public Double terminate() {
            return Percentile.median(state.values);
        }
    }
}
