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

package org.wikimedia.analytics.mediasearch.tools;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionHandlerFilter;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;
import org.wikimedia.analytics.mediasearch.core.analysis.AggregationException;
import org.wikimedia.analytics.mediasearch.core.analysis.Analysis;
import org.wikimedia.analytics.mediasearch.core.analysis.DailyAggregationJob;
import org.wikimedia.analytics.mediasearch.core.config.AnalysisConfigLoader;
import org.wikimedia.analytics.mediasearch.core.config.ConfigLoadingException;
import org.wikimedia.analytics.mediasearch.core.eventlog.EventLog;
import org.wikimedia.analytics.mediasearch.core.eventlog.InputUnavailableException;
import org.wikimedia.analytics.mediasearch.core.eventlog.JsonLinesEventLog;
import org.wikimedia.analytics.mediasearch.core.sink.AggregateSink;
import org.wikimedia.analytics.mediasearch.core.sink.TsvAggregateSink;
import org.wikimedia.analytics.mediasearch.core.sink.WriteMode;
import org.wikimedia.analytics.mediasearch.hive.HiveAggregateSink;
import org.wikimedia.analytics.mediasearch.hive.HiveEventLog;
import org.wikimedia.analytics.mediasearch.hive.HiveStatementRunner;

/**
 * Computes the daily media search aggregates of one day.
 *
 * Events are read either from JSON lines files (--events) or from a Hive
 * table (--jdbc-url and --event-table). Aggregates go either to TSV files
 * (--output-dir) or to Hive tables (--jdbc-url and --output-database).
 * Without --date the data day is yesterday (UTC).
 *
 * Exit status: 0 on success, 2 if the events are not available (the run can
 * be retried later), 1 on any other failure.
 *
 * Example:
 *   java -cp mediasearch-tools.jar org.wikimedia.analytics.mediasearch.tools.DailyAggregation \
 *     --date 2021-03-10 --events /srv/events --output-dir /srv/aggregates --write-mode replace
 */
public class DailyAggregation {

    private static final Logger log = Logger.getLogger(DailyAggregation.class.getName());

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INPUT_UNAVAILABLE = 2;

    protected PrintStream stderr = System.err;
    protected Clock clock = Clock.systemUTC();

    @Option(name = "--help", aliases = {"-help", "-h", "-?"}, help = true,
            usage = "print this help screen")
    private boolean help;

    @Option(name = "--date", metaVar = "YYYY-MM-DD",
            usage = "day whose sessions are aggregated. (default: yesterday, UTC)")
    private String date;

    @Option(name = "--config", metaVar = "FILE",
            usage = "YAML analysis definitions. (default: the bundled analyses.yaml)")
    private File config;

    @Option(name = "--analysis", metaVar = "NAME",
            usage = "only run this analysis, can be repeated. (default: all)")
    private List<String> analysisNames = new ArrayList<>();

    @Option(name = "--events", metaVar = "PATH", forbids = {"--event-table"},
            usage = "JSON lines events: a file or a year=/month=/day= partitioned directory")
    private File events;

    @Option(name = "--require-all-partitions",
            usage = "fail if a partition directory of --events is missing. Without it a missing "
                    + "partition is only logged and the day's counts come out short")
    private boolean requireAllPartitions;

    @Option(name = "--output-dir", metaVar = "DIR", forbids = {"--output-database"},
            usage = "write one <table>.tsv file per aggregate table in DIR")
    private File outputDir;

    @Option(name = "--jdbc-url", metaVar = "URL",
            usage = "Hive JDBC url, for --event-table and --output-database")
    private String jdbcUrl;

    @Option(name = "--event-table", metaVar = "DB.TABLE", depends = {"--jdbc-url"},
            usage = "Hive table to read events from")
    private String eventTable;

    @Option(name = "--event-attribute", metaVar = "NAME[=EXPRESSION]", depends = {"--event-table"},
            usage = "attribute to read from --event-table, can be repeated. "
                    + "(default: the attributes of the bundled analyses)")
    private List<String> eventAttributes = new ArrayList<>();

    @Option(name = "--output-database", metaVar = "DB", depends = {"--jdbc-url"},
            usage = "Hive database to write aggregate tables to")
    private String outputDatabase;

    @Option(name = "--write-mode", metaVar = "append|replace",
            usage = "append rows, or replace the rows of the day. (default: append)")
    private String writeMode = WriteMode.APPEND.name().toLowerCase();

    private CmdLineParser parser;

    public static void main(String[] args) {
        new DailyAggregation().doMain(args);
    }

    protected void exit(int status) {
        System.exit(status);
    }

    /**
     * Opens the JDBC connection, the Hive driver is expected on the classpath.
     */
    protected Connection connect(String url) throws SQLException {
        return DriverManager.getConnection(url);
    }

    private void parseArgs(String[] args) {
        parser = new CmdLineParser(this);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            stderr.println(e.getMessage());
            parser.printUsage(stderr);
            exit(EXIT_FAILURE);
            return;
        }

        if (help) {
            parser.printUsage(stderr);
            stderr.println();
            stderr.print(parser.printExample(OptionHandlerFilter.ALL));
            exit(EXIT_OK);
        }
    }

    private void usageError(String message) {
        stderr.println(message);
        parser.printUsage(stderr);
        exit(EXIT_FAILURE);
    }

    private void exitWithException(String reason, Exception e, int status) {
        log.error(reason, e);
        stderr.println(reason + ": " + e.getMessage());
        exit(status);
    }

    protected void doMain(String[] args) {
        parseArgs(args);

        if (events == null && eventTable == null) {
            usageError("One of --events or --event-table is required");
            return;
        }
        if (outputDir == null && outputDatabase == null) {
            usageError("One of --output-dir or --output-database is required");
            return;
        }

        RunWindow window;
        WriteMode mode;
        try {
            window = date == null ? RunWindow.fromClock(clock) : RunWindow.forDataDay(LocalDate.parse(date));
            mode = WriteMode.fromName(writeMode);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            usageError("Invalid option: " + e.getMessage());
            return;
        }

        List<Analysis> analyses;
        try {
            analyses = selectAnalyses(loadAnalyses());
        } catch (ConfigLoadingException e) {
            exitWithException("Failed to load analyses", e, EXIT_FAILURE);
            return;
        }

        Connection connection = null;
        try {
            if (jdbcUrl != null) {
                connection = connect(jdbcUrl);
            }
            DailyAggregationJob job = new DailyAggregationJob(eventLog(connection), sink(connection), mode);
            List<AggregateTable> written = job.run(window, analyses);
            log.info("Wrote " + written.size() + " tables for " + window.getDataDay());
        } catch (InputUnavailableException e) {
            exitWithException("Events of " + window + " are not available", e, EXIT_INPUT_UNAVAILABLE);
            return;
        } catch (AggregationException e) {
            exitWithException("Failed to write " + e.getTable(), e, EXIT_FAILURE);
            return;
        } catch (SQLException | IOException e) {
            exitWithException("Failed to set up the run of " + window, e, EXIT_FAILURE);
            return;
        } finally {
            closeQuietly(connection);
        }
        exit(EXIT_OK);
    }

    private List<Analysis> loadAnalyses() throws ConfigLoadingException {
        AnalysisConfigLoader loader = new AnalysisConfigLoader();
        return config == null ? loader.loadDefault() : loader.load(config);
    }

    private List<Analysis> selectAnalyses(List<Analysis> all) throws ConfigLoadingException {
        if (analysisNames.isEmpty()) {
            return all;
        }
        Map<String, Analysis> byName = new LinkedHashMap<>();
        for (Analysis analysis : all) {
            byName.put(analysis.getName(), analysis);
        }
        List<Analysis> selected = new ArrayList<>();
        for (String name : analysisNames) {
            Analysis analysis = byName.get(name);
            if (analysis == null) {
                throw new ConfigLoadingException("Unknown analysis " + name + ", known ones are " + byName.keySet());
            }
            selected.add(analysis);
        }
        return selected;
    }

    private EventLog eventLog(Connection connection) {
        if (events != null) {
            return new JsonLinesEventLog(events, requireAllPartitions);
        }
        Map<String, String> columns = new LinkedHashMap<>();
        if (eventAttributes.isEmpty()) {
            columns.putAll(HiveEventLog.sameNameColumns(HiveEventLog.DEFAULT_ATTRIBUTES));
        }
        for (String attribute : eventAttributes) {
            int separator = attribute.indexOf('=');
            if (separator < 0) {
                columns.put(attribute, attribute);
            } else {
                columns.put(attribute.substring(0, separator), attribute.substring(separator + 1));
            }
        }
        return new HiveEventLog(new HiveStatementRunner(connection), eventTable, columns);
    }

    private AggregateSink sink(Connection connection) throws IOException {
        if (outputDir != null) {
            FileUtils.forceMkdir(outputDir);
            return new TsvAggregateSink(outputDir);
        }
        return new HiveAggregateSink(new HiveStatementRunner(connection), outputDatabase);
    }

    private static void closeQuietly(Connection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to close the JDBC connection", e);
        }
    }
}
