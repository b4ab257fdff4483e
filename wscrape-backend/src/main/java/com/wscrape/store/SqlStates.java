package com.wscrape.store;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

final class SqlStates {
    // SQLSTATE class 23: integrity constraint violation
    private static final String INTEGRITY_CONSTRAINT_CLASS = "23";

    private SqlStates() {
    }

    static boolean isConstraintViolation(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException) {
            return true;
        }
        String sqlState = e.getSQLState();
        return sqlState != null && sqlState.startsWith(INTEGRITY_CONSTRAINT_CLASS);
    }
}
