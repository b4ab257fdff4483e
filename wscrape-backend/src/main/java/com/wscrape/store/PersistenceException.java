package com.wscrape.store;

/**
 * Thrown when a single {@link com.wscrape.model.LoginEntry} cannot be written.
 */
public class PersistenceException extends Exception {
    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
