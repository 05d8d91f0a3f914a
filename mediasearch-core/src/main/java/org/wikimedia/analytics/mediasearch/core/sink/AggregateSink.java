package org.wikimedia.analytics.mediasearch.core.sink;

import java.io.IOException;

import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;

/**
 * Destination of aggregate rows.
 *
 * Sinks do not coordinate concurrent writers: running two jobs for the
 * same table and log date at once is not supported.
 */
public interface AggregateSink {

    /**
     * Adds the rows to the table, leaving rows already there untouched.
     * Writing the same log date twice leaves duplicate rows.
     */
    void append(AggregateTable table) throws IOException;

    /**
     * Replaces the rows of the table's log date by the given rows.
     */
    void replace(AggregateTable table) throws IOException;
}
