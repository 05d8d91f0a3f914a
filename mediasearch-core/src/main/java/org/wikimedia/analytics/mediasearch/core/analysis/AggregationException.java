package org.wikimedia.analytics.mediasearch.core.analysis;

/**
 * Thrown when the rows of a table could not be written. Tables written
 * before the failure are kept.
 */
public class AggregationException extends Exception {

    private final String table;

    public AggregationException(String table, String message, Exception cause) {
        super(message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
