package com.wscrape.config;

/**
 * Thrown when a scraper cannot be built: unreadable or malformed credentials, or a store or SSH host that
 * refuses the initial connection.
 */
public class ConfigurationException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying failure
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
