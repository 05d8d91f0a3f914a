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

import java.io.IOException;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateRow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;
import org.wikimedia.analytics.mediasearch.core.sink.AggregateSink;

/**
 * Writes aggregate rows to Hive tables of a database over JDBC.
 *
 * Target tables are expected to exist with the columns of the aggregate
 * table, log_date first. Replacing a log date rewrites the whole table
 * without the rows of that date, then inserts the new rows; aggregate
 * tables are small enough for that.
 */
public class HiveAggregateSink implements AggregateSink {

    private static final Logger log = Logger.getLogger(HiveAggregateSink.class.getName());

    private static final Joiner COMMA = Joiner.on(", ");

    private final HiveStatementRunner runner;
    private final String database;

    public HiveAggregateSink(HiveStatementRunner runner, String database) {
        Preconditions.checkArgument(database != null && !database.isEmpty(), "An output database is required");
        this.runner = runner;
        this.database = database;
    }

    public String tableName(AggregateTable table) {
        return database + "." + table.getName();
    }

    @Override
    public void append(AggregateTable table) throws IOException {
        if (table.getRows().isEmpty()) {
            log.info("No rows to write to " + tableName(table));
            return;
        }
        execute(buildInsert(table), table);
        log.info("Inserted " + table.getRows().size() + " rows into " + tableName(table));
    }

    @Override
    public void replace(AggregateTable table) throws IOException {
        execute(buildDeleteLogDate(table), table);
        log.info("Dropped rows of " + table.getLogDate() + " from " + tableName(table));
        append(table);
    }

    public String buildInsert(AggregateTable table) {
        List<String> rows = new ArrayList<>(table.getRows().size());
        for (AggregateRow row : table.getRows()) {
            List<String> values = new ArrayList<>();
            for (Object value : row.getValues()) {
                values.add(literal(value));
            }
            rows.add("(" + COMMA.join(values) + ")");
        }
        return "INSERT INTO TABLE " + tableName(table)
            + " (" + COMMA.join(table.getColumns()) + ")"
            + " VALUES " + COMMA.join(rows);
    }

    public String buildDeleteLogDate(AggregateTable table) {
        return "INSERT OVERWRITE TABLE " + tableName(table)
            + " SELECT " + COMMA.join(table.getColumns())
            + " FROM " + tableName(table)
            + " WHERE " + AggregateTable.LOG_DATE_COLUMN + " <> " + literal(table.getLogDate());
    }

    static String literal(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof LocalDate) {
            return "'" + value + "'";
        }
        return "'" + value.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private void execute(String sql, AggregateTable table) throws IOException {
        try {
            runner.executeUpdate(sql);
        } catch (SQLException e) {
            throw new IOException("Failed writing " + tableName(table) + " for " + table.getLogDate(), e);
        }
    }
}
