package com.fusestorage.engine;

import java.sql.SQLException;

/**
 * Gateway to an engine. Reads may run concurrently; writes are serialized and each write runs as one
 * transaction.
 */
public interface DatabaseQueue extends AutoCloseable {
    <T> T read(ConnectionCallback<T> callback) throws SQLException;

    <T> T write(ConnectionCallback<T> callback) throws SQLException;

    @Override
    void close();
}
