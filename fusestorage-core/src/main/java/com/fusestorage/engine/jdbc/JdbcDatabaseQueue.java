package com.fusestorage.engine.jdbc;

import com.fusestorage.engine.ConnectionCallback;
import com.fusestorage.engine.DatabaseQueue;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link DatabaseQueue} over a HikariCP pool.
 *
 * <p>Reads borrow a pooled connection and run in auto-commit mode. Writes are serialized by a lock and each
 * runs in a single transaction that is committed on success and rolled back on any exception.
 */
@Slf4j
public class JdbcDatabaseQueue implements DatabaseQueue {
    private final HikariDataSource dataSource;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcDatabaseQueue(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public <T> T read(ConnectionCallback<T> callback) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            return callback.doInConnection(new JdbcDatabaseConnection(conn));
        }
    }

    @Override
    public <T> T write(ConnectionCallback<T> callback) throws SQLException {
        writeLock.lock();
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            T result;
            try {
                result = callback.doInConnection(new JdbcDatabaseConnection(conn));
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                restoreAutoCommit(conn, autoCommit, e);
                throw e;
            }
            restoreAutoCommit(conn, autoCommit, null);
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit, Exception cause) throws SQLException {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException restoreFailure) {
            if (cause == null) {
                throw restoreFailure;
            }
            log.warn("Restoring auto-commit failed after {}: {}", cause.getClass().getSimpleName(),
                    restoreFailure.getMessage());
            cause.addSuppressed(restoreFailure);
        }
    }

    private static void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            log.warn("Rollback failed after {}: {}", cause.getClass().getSimpleName(), rollbackFailure.getMessage());
            cause.addSuppressed(rollbackFailure);
        }
    }

    public boolean isClosed() {
        return dataSource.isClosed();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            log.info("Closing database pool {}", dataSource.getPoolName());
            dataSource.close();
        }
    }
}
