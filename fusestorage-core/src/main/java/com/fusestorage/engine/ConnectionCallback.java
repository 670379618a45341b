package com.fusestorage.engine;

import java.sql.SQLException;

/**
 * Unit of work run against a connection by a {@link DatabaseQueue}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ConnectionCallback<T> {
    T doInConnection(DatabaseConnection connection) throws SQLException;
}
