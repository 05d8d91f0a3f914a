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

package org.wikimedia.analytics.mediasearch.core.sink;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateRow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;

/**
 * Keeps written rows in memory, for dry runs and tests.
 */
public class InMemoryAggregateSink implements AggregateSink {

    private final Map<String, List<AggregateRow>> tables = new LinkedHashMap<>();

    @Override
    public void append(AggregateTable table) {
        rowsOf(table.getName()).addAll(table.getRows());
    }

    @Override
    public void replace(AggregateTable table) {
        List<AggregateRow> rows = rowsOf(table.getName());
        LocalDate logDate = table.getLogDate();
        for (Iterator<AggregateRow> it = rows.iterator(); it.hasNext(); ) {
            if (it.next().getLogDate().equals(logDate)) {
                it.remove();
            }
        }
        rows.addAll(table.getRows());
    }

    /**
     * @return every row written to the table so far, in write order
     */
    public List<AggregateRow> getRows(String table) {
        List<AggregateRow> rows = tables.get(table);
        return rows == null ? Collections.<AggregateRow>emptyList() : Collections.unmodifiableList(rows);
    }

    public List<String> getTableNames() {
        return new ArrayList<>(tables.keySet());
    }

    private List<AggregateRow> rowsOf(String table) {
        return tables.computeIfAbsent(table, name -> new ArrayList<>());
    }
}
