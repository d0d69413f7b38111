package com.ryuqq.dmo.adapter.postgres;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

/**
 * Classifies PostgreSQL driver and pool failures by SQLState.
 */
final class PostgresErrors {

    static final String UNIQUE_VIOLATION = "23505";
    static final String FOREIGN_KEY_VIOLATION = "23503";

    private PostgresErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean isUniqueViolation(SQLException e) {
        return UNIQUE_VIOLATION.equals(e.getSQLState());
    }

    static boolean isForeignKeyViolation(SQLException e) {
        return FOREIGN_KEY_VIOLATION.equals(e.getSQLState());
    }

    /**
     * Pool acquisition timeouts, connection exceptions (class 08) and server shutdown
     * (57P01-57P03). These are worth retrying.
     */
    static boolean isUnavailable(SQLException e) {
        if (e instanceof SQLTransientConnectionException) {
            return true;
        }
        String state = e.getSQLState();
        if (state == null) {
            return false;
        }
        return state.startsWith("08")
            || "57P01".equals(state)
            || "57P02".equals(state)
            || "57P03".equals(state);
    }
}
