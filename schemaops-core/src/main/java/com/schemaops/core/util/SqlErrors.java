package com.schemaops.core.util;

import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DeadlockLoserDataAccessException;

import java.sql.SQLException;
import java.util.Locale;

/**
 * Classifies database failures by PostgreSQL SQLSTATE, walking the cause chain.
 */
public final class SqlErrors {

    public static final String DEADLOCK_DETECTED = "40P01";
    public static final String LOCK_NOT_AVAILABLE = "55P03";

    private SqlErrors() {
    }

    /**
     * True for the database's deadlock signal.
     */
    public static boolean isDeadlock(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof DeadlockLoserDataAccessException) {
                return true;
            }
            if (DEADLOCK_DETECTED.equals(sqlState(current))) {
                return true;
            }
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("deadlock detected")) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    /**
     * True when a lock wait was cancelled by {@code lock_timeout}.
     */
    public static boolean isLockNotAvailable(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof CannotAcquireLockException) {
                return true;
            }
            if (LOCK_NOT_AVAILABLE.equals(sqlState(current))) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static String sqlState(Throwable error) {
        return error instanceof SQLException sqlException ? sqlException.getSQLState() : null;
    }
}
