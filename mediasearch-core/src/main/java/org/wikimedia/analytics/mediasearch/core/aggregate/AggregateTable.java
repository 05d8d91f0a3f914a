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
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * Rows computed for one output table and one log date, with the table's
 * fixed schema: log_date, then dimension columns, then metric columns.
 */
public final class AggregateTable {

    public static final String LOG_DATE_COLUMN = "log_date";

    private final String name;
    private final LocalDate logDate;
    private final List<String> dimensionColumns;
    private final List<String> metricColumns;
    private final List<AggregateRow> rows;

    public AggregateTable(String name, LocalDate logDate, List<String> dimensionColumns,
                          List<String> metricColumns, List<AggregateRow> rows) {
        Preconditions.checkArgument(name != null && !name.isEmpty(), "A table needs a name");
        for (AggregateRow row : rows) {
            Preconditions.checkArgument(row.getLogDate().equals(logDate),
                "Row %s does not belong to log date %s", row, logDate);
            Preconditions.checkArgument(new ArrayList<>(row.getDimensions().keySet()).equals(dimensionColumns)
                    && new ArrayList<>(row.getMetrics().keySet()).equals(metricColumns),
                "Row %s does not match the columns of table %s", row, name);
        }
        this.name = name;
        this.logDate = logDate;
        this.dimensionColumns = Collections.unmodifiableList(new ArrayList<>(dimensionColumns));
        this.metricColumns = Collections.unmodifiableList(new ArrayList<>(metricColumns));
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    public String getName() {
        return name;
    }

    public LocalDate getLogDate() {
        return logDate;
    }

    public List<String> getDimensionColumns() {
        return dimensionColumns;
    }

    public List<String> getMetricColumns() {
        return metricColumns;
    }

    public List<String> getColumns() {
        List<String> columns = new ArrayList<>(1 + dimensionColumns.size() + metricColumns.size());
        columns.add(LOG_DATE_COLUMN);
        columns.addAll(dimensionColumns);
        columns.addAll(metricColumns);
        return columns;
    }

    public List<AggregateRow> getRows() {
        return rows;
    }

    @Override
    public String toString() {
        return "AggregateTable{" + name + ", " + logDate + ", " + rows.size() + " rows}";
    }
}
