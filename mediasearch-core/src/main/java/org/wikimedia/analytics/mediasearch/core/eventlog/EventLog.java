package org.wikimedia.analytics.mediasearch.core.eventlog;

import java.util.List;

import org.wikimedia.analytics.mediasearch.core.Event;
import org.wikimedia.analytics.mediasearch.core.partition.PartitionPredicate;

/**
 * Append-only, day partitioned log of interaction events.
 */
public interface EventLog {

    /**
     * Reads the events of every partition the predicate lets through.
     *
     * @throws InputUnavailableException if the partitions can not be read
     */
    List<Event> scan(PartitionPredicate predicate) throws InputUnavailableException;
}
