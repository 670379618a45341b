package com.fusestorage.engine;

import com.fusestorage.model.TableOption;
import com.fusestorage.value.StorageValue;

import java.sql.SQLException;
import java.util.List;
import java.util.Set;

/**
 * Engine connection as seen by a unit of work. Only valid inside the callback it was passed to.
 */
public interface DatabaseConnection {
    /**
     * Execute a statement that returns no rows.
     *
     * @param sql SQL with {@code ?} placeholders
     * @param arguments positional arguments
     * @throws SQLException on engine errors
     */
    void execute(String sql, List<StorageValue> arguments) throws SQLException;

    /**
     * Check whether a table exists. The name is compared exactly.
     *
     * @param tableName table name
     * @return true when present
     * @throws SQLException on engine errors
     */
    boolean tableExists(String tableName) throws SQLException;

    /**
     * Create a table; columns are declared through {@code body}.
     *
     * @param tableName table name
     * @param options creation options
     * @param body column declarations
     * @throws SQLException on engine errors
     */
    void createTable(String tableName, Set<TableOption> options, TableBuilderBody body)
            throws SQLException;

    /**
     * Run a query and materialize every row.
     *
     * @param sql SQL with {@code ?} placeholders
     * @param arguments positional arguments
     * @return rows in result order
     * @throws SQLException on engine errors
     */
    List<DatabaseRow> fetchRows(String sql, List<StorageValue> arguments) throws SQLException;
}
