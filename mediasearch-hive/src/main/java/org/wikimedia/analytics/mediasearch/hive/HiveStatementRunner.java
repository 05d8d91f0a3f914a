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

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Runs HiveQL statements over a JDBC connection.
 *
 * Some Hive JDBC drivers report a write-only statement (INSERT, INSERT
 * OVERWRITE) that ran fine as a failure, because no result set came back.
 * {@link #executeUpdate(String)} treats exactly that error as a success,
 * recognized by the driver's message and nothing else.
 */
public class HiveStatementRunner {

    private static final Logger log = Logger.getLogger(HiveStatementRunner.class.getName());

    public static final String NO_RESULT_SET_MESSAGE = "The query did not generate a result set";

    /**
     * Maps the current row of a result set.
     */
    public interface RowMapper<T> {
        T map(ResultSet resultSet) throws SQLException;
    }

    private final Connection connection;

    public HiveStatementRunner(Connection connection) {
        this.connection = connection;
    }

    /**
     * Runs a statement that does not return rows.
     *
     * @throws SQLException any failure but a missing result set
     */
    public void executeUpdate(String sql) throws SQLException {
        log.debug("Executing " + sql);
        try (Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            if (!isMissingResultSet(e)) {
                throw e;
            }
            log.warn("Ignoring '" + e.getMessage() + "' for a statement without result set");
        }
    }

    public <T> List<T> query(String sql, RowMapper<T> mapper) throws SQLException {
        log.debug("Querying " + sql);
        List<T> rows = new ArrayList<>();
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            while (resultSet.next()) {
                rows.add(mapper.map(resultSet));
            }
        }
        return rows;
    }

    static boolean isMissingResultSet(SQLException e) {
        String message = e.getMessage();
        return message != null && message.startsWith(NO_RESULT_SET_MESSAGE);
    }
}
