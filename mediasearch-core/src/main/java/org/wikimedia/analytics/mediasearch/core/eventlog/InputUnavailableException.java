package org.wikimedia.analytics.mediasearch.core.eventlog;

/**
 * Thrown when the events of a requested window can not be read, or are
 * known to be incomplete. A run can not produce correct counts without
 * them.
 */
public class InputUnavailableException extends Exception {
    public InputUnavailableException(String message) {
        super(message);
    }

    public InputUnavailableException(String message, Exception cause) {
        super(message, cause);
    }
}
