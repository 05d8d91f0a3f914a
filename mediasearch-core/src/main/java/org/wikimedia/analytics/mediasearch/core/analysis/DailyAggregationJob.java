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

package org.wikimedia.analytics.mediasearch.core.analysis;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;
import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;
import org.wikimedia.analytics.mediasearch.core.eventlog.EventLog;
import org.wikimedia.analytics.mediasearch.core.eventlog.InputUnavailableException;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;
import org.wikimedia.analytics.mediasearch.core.sink.AggregateSink;
import org.wikimedia.analytics.mediasearch.core.sink.WriteMode;

/**
 * Runs analyses for one data day: scans the window's partitions once,
 * computes every table, then writes them one by one.
 *
 * A failed write stops the run. Tables written before it stay written,
 * there is no transaction across tables. Running the same day twice at
 * the same time is not supported, the scheduler has to serialize runs.
 */
public class DailyAggregationJob {

    private static final Logger log = Logger.getLogger(DailyAggregationJob.class.getName());

    private final EventLog eventLog;
    private final AggregateSink sink;
    private final WriteMode writeMode;

    public DailyAggregationJob(EventLog eventLog, AggregateSink sink, WriteMode writeMode) {
        this.eventLog = eventLog;
        this.sink = sink;
        this.writeMode = writeMode;
    }

    /**
     * @return the tables that were written
     * @throws InputUnavailableException if the events could not be read, nothing is written then
     * @throws AggregationException      if a table could not be written
     */
    public List<AggregateTable> run(RunWindow window, List<Analysis> analyses)
        throws InputUnavailableException, AggregationException {

        PartitionPredicate predicate = window.getScanPredicate();
        log.info("Running " + analyses.size() + " analyses for " + window.getDataDay() + ", scanning " + predicate);
        List<Event> events = eventLog.scan(predicate);

        List<AggregateTable> tables = new ArrayList<>();
        for (Analysis analysis : analyses) {
            tables.addAll(analysis.run(window, events));
        }

        List<AggregateTable> written = new ArrayList<>();
        for (AggregateTable table : tables) {
            try {
                writeMode.write(sink, table);
            } catch (IOException e) {
                throw new AggregationException(table.getName(),
                    "Failed writing " + table.getName() + " for " + table.getLogDate()
                        + " after writing " + written.size() + " tables", e);
            }
            written.add(table);
            log.info("Wrote " + table.getRows().size() + " rows to " + table.getName() + " (" + writeMode + ")");
        }
        return written;
    }
}
