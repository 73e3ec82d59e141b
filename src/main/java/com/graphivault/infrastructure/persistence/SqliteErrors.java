package com.graphivault.infrastructure.persistence;

import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

/**
 * Classifies SQLite constraint failures wrapped inside Spring's {@code DataAccessException} hierarchy.
 */
public final class SqliteErrors {

    private SqliteErrors() {}

    public static boolean isUniqueViolation(Throwable failure) {
        return matches(failure, SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE, "UNIQUE constraint failed");
    }

    public static boolean isForeignKeyViolation(Throwable failure) {
        return matches(failure, SQLiteErrorCode.SQLITE_CONSTRAINT_FOREIGNKEY, "FOREIGN KEY constraint failed");
    }

    private static boolean matches(Throwable failure, SQLiteErrorCode code, String marker) {
        Throwable current = failure;
        while (current != null) {
            if (current instanceof SQLiteException sqlite && sqlite.getResultCode() == code) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.contains(marker)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
