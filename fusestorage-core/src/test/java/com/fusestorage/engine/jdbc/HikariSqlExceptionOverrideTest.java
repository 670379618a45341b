package com.fusestorage.engine.jdbc;

import com.zaxxer.hikari.SQLExceptionOverride;
import org.junit.jupiter.api.Test;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLIntegrityConstraintViolationException;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HikariSqlExceptionOverrideTest {
    private final HikariSqlExceptionOverride override = new HikariSqlExceptionOverride();

    @Test
    void statementErrorsKeepTheConnection() {
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT, override.adjudicate(new SQLFeatureNotSupportedException("nope")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT,
                override.adjudicate(new SQLIntegrityConstraintViolationException("duplicate")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT, override.adjudicate(new SQLException("dup", "23505")));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT, override.adjudicate(new SQLException("unsupported", "0A000")));
    }

    @Test
    void sqliteConstraintAndBusyKeepTheConnection() {
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT, override.adjudicate(
                new SQLiteException("UNIQUE constraint failed", SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY)));
        assertEquals(SQLExceptionOverride.Override.DO_NOT_EVICT, override.adjudicate(
                new SQLiteException("database is locked", SQLiteErrorCode.SQLITE_BUSY)));
    }

    @Test
    void sameCodeFromAnotherDriverEvicts() {
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT, override.adjudicate(new SQLException("other", null, 19)));
    }

    @Test
    void connectionErrorsEvict() {
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT, override.adjudicate(new SQLException("broken pipe", "08006")));
        assertEquals(SQLExceptionOverride.Override.CONTINUE_EVICT, override.adjudicate(null));
    }
}
