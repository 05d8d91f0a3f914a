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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One output row: log date, dimension values and metric values, each in
 * column order.
 *
 * The log date and dimension values form the logical key of the row.
 * Nothing enforces its uniqueness in an output table.
 */
public final class AggregateRow {

    private final LocalDate logDate;
    private final Map<String, String> dimensions;
    private final Map<String, Number> metrics;

    public AggregateRow(LocalDate logDate, Map<String, String> dimensions, Map<String, Number> metrics) {
        this.logDate = Objects.requireNonNull(logDate, "logDate");
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public LocalDate getLogDate() {
        return logDate;
    }

    public Map<String, String> getDimensions() {
        return dimensions;
    }

    public Map<String, Number> getMetrics() {
        return metrics;
    }

    public String getDimension(String column) {
        return dimensions.get(column);
    }

    public Number getMetric(String column) {
        return metrics.get(column);
    }

    /**
     * @return log date followed by the dimension values
     */
    public List<String> getKey() {
        List<String> key = new ArrayList<>(dimensions.size() + 1);
        key.add(logDate.toString());
        key.addAll(dimensions.values());
        return key;
    }

    /**
     * @return every value of the row, in column order
     */
    public List<Object> getValues() {
        List<Object> values = new ArrayList<>(1 + dimensions.size() + metrics.size());
        values.add(logDate);
        values.addAll(dimensions.values());
        values.addAll(metrics.values());
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AggregateRow)) {
            return false;
        }
        AggregateRow that = (AggregateRow) o;
        return logDate.equals(that.logDate)
            && dimensions.equals(that.dimensions)
            && metrics.equals(that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logDate, dimensions, metrics);
    }

    @Override
    public String toString() {
        return "AggregateRow{" + logDate + ", " + dimensions + ", " + metrics + '}';
    }
}
