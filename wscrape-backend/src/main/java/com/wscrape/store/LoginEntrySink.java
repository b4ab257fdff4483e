package com.wscrape.store;

import com.wscrape.model.LoginEntry;

/**
 * Durable destination for parsed entries.
 */
public interface LoginEntrySink {

    /**
     * Write one entry.
     *
     * @param entry entry to store
     * @throws DuplicateLoginEntryException if the key already exists
     * @throws PersistenceException for any other write failure
     */
    void save(LoginEntry entry) throws PersistenceException;
}
