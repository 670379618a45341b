package com.fusestorage.engine.jdbc;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JdbcDatabaseQueueTest {

    /**
     * Pool handing out one connection whose auto-commit cannot be switched back on.
     */
    static class FailingRestorePool extends HikariDataSource {
        final List<String> calls = new ArrayList<>();

        @Override
        public Connection getConnection() {
            return (Connection) Proxy.newProxyInstance(getClass().getClassLoader(), new Class<?>[] {Connection.class},
                    (proxy, method, args) -> {
                        calls.add(method.getName());
                        switch (method.getName()) {
                            case "getAutoCommit":
                                return true;
                            case "setAutoCommit":
                                if ((Boolean) args[0]) {
                                    throw new SQLException("restore");
                                }
                                return null;
                            case "isClosed":
                                return false;
                            default:
                                return null;
                        }
                    });
        }
    }

    @Test
    void write_restoreFailureIsSuppressedUnderTheCallbackFailure() {
        FailingRestorePool pool = new FailingRestorePool();
        JdbcDatabaseQueue queue = new JdbcDatabaseQueue(pool);

        SQLException e = assertThrows(SQLException.class, () -> queue.write(db -> {
            throw new SQLException("boom");
        }));

        assertEquals("boom", e.getMessage());
        assertEquals(1, e.getSuppressed().length);
        assertEquals("restore", e.getSuppressed()[0].getMessage());
        assertEquals(List.of("getAutoCommit", "setAutoCommit", "rollback", "setAutoCommit", "close"), pool.calls);
    }

    @Test
    void write_restoreFailureAfterCommitIsThrown() {
        FailingRestorePool pool = new FailingRestorePool();
        JdbcDatabaseQueue queue = new JdbcDatabaseQueue(pool);

        SQLException e = assertThrows(SQLException.class, () -> queue.write(db -> "done"));

        assertEquals("restore", e.getMessage());
        assertEquals(List.of("getAutoCommit", "setAutoCommit", "commit", "setAutoCommit", "close"), pool.calls);
    }
}
