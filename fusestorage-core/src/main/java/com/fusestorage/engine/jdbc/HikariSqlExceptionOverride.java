package com.fusestorage.engine.jdbc;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * HikariCP SQL exception override that keeps pooled connections alive for statement-level errors.
 *
 * <p>Constraint violations from inserts and upserts, lock contention and unsupported features say
 * nothing about the health of the connection and should not evict it.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {
    // SQLite primary result codes
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;

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

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLIntegrityConstraintViolationException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && (sqlState.startsWith("0A") || sqlState.startsWith("23"))) {
            // 0A: feature not supported, 23: integrity constraint violation
            return Override.DO_NOT_EVICT;
        }

        // SQLite reports extended result codes; the low byte is the primary code.
        int primary = sqlException.getErrorCode() & 0xff;
        if (primary == SQLITE_CONSTRAINT || primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
            return isSqlite(sqlException) ? Override.DO_NOT_EVICT : Override.CONTINUE_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }

    private static boolean isSqlite(SQLException e) {
        return e.getClass().getName().startsWith("org.sqlite.")
                || (e.getMessage() != null && e.getMessage().startsWith("[SQLITE_"));
    }
}
