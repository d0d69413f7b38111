package com.ryuqq.dmo.adapter.sqlite;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Classifies sqlite-jdbc failures. The driver reports extended result codes, but the
 * message text is checked too so that a plain {@code SQLITE_CONSTRAINT} is still recognised.
 */
final class SqliteErrors {

    private SqliteErrors() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite
            && sqlite.getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE) {
            return true;
        }
        return e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed");
    }

    static boolean isForeignKeyViolation(SQLException e) {
        if (e instanceof SQLiteException sqlite
            && sqlite.getResultCode() == SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY) {
            return true;
        }
        return e.getMessage() != null && e.getMessage().contains("FOREIGN KEY constraint failed");
    }
}
