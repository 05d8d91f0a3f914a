package org.wikimedia.analytics.mediasearch.core.analysis;

import java.util.List;

import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.RunWindow;
import org.wikimedia.analytics.mediasearch.core.aggregate.AggregateTable;

/**
 * One daily aggregation, producing one or more output tables from the
 * events scanned for a run window.
 */
public interface Analysis {

    String getName();

    /**
     * @param window the run window, its data day is the log date of every row
     * @param events events of the window's scan days
     */
    List<AggregateTable> run(RunWindow window, List<Event> events);
}
