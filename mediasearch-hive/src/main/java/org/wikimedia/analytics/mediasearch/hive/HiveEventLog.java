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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.Timestamps;
import org.wikimedia.analytics.mediasearch.core.eventlog.EventLog;
import org.wikimedia.analytics.mediasearch.core.eventlog.InputUnavailableException;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionKey;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;

/**
 * Event log stored in a partitioned Hive table, read over JDBC.
 *
 * Attributes are selected from column expressions, for instance
 * search_interface from event.search_interface when the table keeps the
 * event payload in a struct.
 */
public class HiveEventLog implements EventLog {

    private static final Logger log = Logger.getLogger(HiveEventLog.class.getName());

    /**
     * Attributes read by the bundled analyses.
     */
    public static final List<String> DEFAULT_ATTRIBUTES = Collections.unmodifiableList(Arrays.asList(
        "search_interface", "position", "filter_type", "filter_value", "mode"));

    private final HiveStatementRunner runner;
    private final String table;
    private final Map<String, String> attributeColumns;

    /**
     * @param table            database qualified table name
     * @param attributeColumns attribute name to the column expression it is read from
     */
    public HiveEventLog(HiveStatementRunner runner, String table, Map<String, String> attributeColumns) {
        Preconditions.checkArgument(table != null && !table.isEmpty(), "An event table is required");
        this.runner = runner;
        this.table = table;
        this.attributeColumns = Collections.unmodifiableMap(new LinkedHashMap<>(attributeColumns));
    }

    /**
     * Reads each of the given attributes from the column of the same name.
     */
    public static Map<String, String> sameNameColumns(List<String> attributes) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (String attribute : attributes) {
            columns.put(attribute, attribute);
        }
        return columns;
    }

    public String buildQuery(PartitionPredicate predicate) {
        StringBuilder sb = new StringBuilder("SELECT dt, session_id, action");
        for (Map.Entry<String, String> attribute : attributeColumns.entrySet()) {
            sb.append(", ").append(attribute.getValue()).append(" AS ").append(attribute.getKey());
        }
        sb.append(", ").append(Joiner.on(", ").join(
            predicate.qualify(PartitionPredicate.YEAR_COLUMN),
            predicate.qualify(PartitionPredicate.MONTH_COLUMN),
            predicate.qualify(PartitionPredicate.DAY_COLUMN)));
        sb.append(" FROM ").append(table);
        if (predicate.getAlias() != null) {
            sb.append(" ").append(predicate.getAlias());
        }
        sb.append(" WHERE ").append(HivePartitionPredicateRenderer.render(predicate));
        return sb.toString();
    }

    @Override
    public List<Event> scan(PartitionPredicate predicate) throws InputUnavailableException {
        String query = buildQuery(predicate);
        List<Event> events;
        try {
            events = runner.query(query, this::toEvent);
        } catch (SQLException e) {
            throw new InputUnavailableException("Failed reading events from " + table + " for " + predicate, e);
        }
        log.info("Read " + events.size() + " events from " + table + " for " + predicate);
        return events;
    }

    /**
     * Columns are read by position, labels of qualified columns vary
     * between Hive versions.
     */
    private Event toEvent(ResultSet resultSet) throws SQLException {
        Instant timestamp;
        try {
            timestamp = Timestamps.parse(resultSet.getString(1));
        } catch (IllegalArgumentException e) {
            throw new SQLException("Invalid dt in " + table, e);
        }
        if (timestamp == null) {
            throw new SQLException("Event without dt in " + table);
        }

        int column = 4;
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (String attribute : attributeColumns.keySet()) {
            Object value = resultSet.getObject(column++);
            if (value != null) {
                attributes.put(attribute, value);
            }
        }

        return new Event(
            timestamp,
            resultSet.getString(2),
            resultSet.getString(3),
            attributes,
            new PartitionKey(resultSet.getInt(column), resultSet.getInt(column + 1), resultSet.getInt(column + 2))
        );
    }
}
