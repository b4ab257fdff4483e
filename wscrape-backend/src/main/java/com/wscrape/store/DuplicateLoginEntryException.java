package com.wscrape.store;

/**
 * Thrown when an entry with the same (user, record_time, tty) key is already stored.
 */
public class DuplicateLoginEntryException extends PersistenceException {
    public DuplicateLoginEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
