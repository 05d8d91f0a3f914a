package org.wikimedia.analytics.mediasearch.core.config;

/**
 * Thrown when analysis definitions can not be read or are invalid.
 */
public class ConfigLoadingException extends Exception {
    public ConfigLoadingException(String message) {
        super(message);
    }

    public ConfigLoadingException(String message, Exception cause) {
        super(message, cause);
    }
}
