package com.koni.climate.infrastructure.persistence;

import com.koni.climate.domain.exception.StorageException;
import com.koni.climate.domain.exception.StoreBusyException;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/**
 * Maps SQLite failures onto the storage error taxonomy.
 * Result codes are checked first; messages are the fallback because the driver
 * reports either primary or extended codes depending on the call path.
 */
final class SqliteErrors {

    private SqliteErrors() {
    }

    static boolean isBusy(SQLException e) {
        if (e instanceof SQLiteException) {
            SQLiteErrorCode code = ((SQLiteException) e).getResultCode();
            if (code != null) {
                String name = code.name();
                if (name.startsWith("SQLITE_BUSY") || name.startsWith("SQLITE_LOCKED")) {
                    return true;
                }
            }
        }
        String message = e.getMessage();
        return message != null
                && (message.contains("SQLITE_BUSY")
                || message.contains("SQLITE_LOCKED")
                || message.contains("database is locked"));
    }

    static boolean isUniqueViolation(SQLException e) {
        if (e instanceof SQLiteException) {
            SQLiteErrorCode code = ((SQLiteException) e).getResultCode();
            if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE
                    || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
                return true;
            }
        }
        String message = e.getMessage();
        return message != null && message.contains("UNIQUE constraint failed");
    }

    static StorageException translate(String operation, SQLException e) {
        if (isBusy(e)) {
            return new StoreBusyException("Store busy during " + operation + ": " + e.getMessage(), e);
        }
        return new StorageException("Failed to " + operation + ": " + e.getMessage(), e);
    }
}
