package com.fusestorage.engine;

import com.fusestorage.config.DatabaseSettings;

import java.sql.SQLException;

/**
 * Creates {@link DatabaseQueue}s for a configured database.
 */
public interface DatabaseFactory {
    /**
     * Open a queue; the caller owns it and must close it.
     *
     * @param settings database settings
     * @return open queue
     * @throws SQLException when the database cannot be reached
     */
    DatabaseQueue createDatabaseQueue(DatabaseSettings settings) throws SQLException;
}
