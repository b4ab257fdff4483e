package com.wscrape.store;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;

/**
 * HikariCP SQL exception override that keeps the store connection alive for constraint violations.
 *
 * Re-capturing a session within the same second produces a duplicate key, which says nothing about the
 * health of the connection. Evicting on it would force a reconnect on every duplicate.
 */
public class StoreSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (SqlStates.isConstraintViolation(sqlException)) {
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
