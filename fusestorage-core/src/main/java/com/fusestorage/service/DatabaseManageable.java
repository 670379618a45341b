package com.fusestorage.service;

import com.fusestorage.engine.DatabaseRow;
import com.fusestorage.model.TableDefinition;
import com.fusestorage.query.Query;
import com.fusestorage.query.QueryFilter;
import com.fusestorage.query.QuerySort;
import com.fusestorage.record.DatabaseRecord;
import com.fusestorage.record.RecordContract;

import java.sql.SQLException;
import java.util.List;

/**
 * Record-level access to one database.
 */
public interface DatabaseManageable extends AutoCloseable {

    boolean tableExists(String tableName) throws SQLException;

    /**
     * Create a table from its definition.
     *
     * @param definition table definition
     * @throws com.fusestorage.exception.TableAlreadyExistsException when the table exists and the definition
     *         does not carry {@code IF_NOT_EXISTS}
     * @throws SQLException on engine errors
     */
    void createTable(TableDefinition definition) throws SQLException;

    <T extends DatabaseRecord<T>> void add(T record) throws SQLException;

    /**
     * Insert records with a single multi-row statement. An empty list does nothing.
     *
     * @param records records of one type
     * @param <T> record type
     * @throws SQLException on engine errors
     */
    <T extends DatabaseRecord<T>> void add(List<T> records) throws SQLException;

    /**
     * Insert the record, or update every non-id column when a row with the same id exists.
     *
     * @param record record
     * @param <T> record type
     * @throws SQLException on engine errors
     */
    <T extends DatabaseRecord<T>> void upsert(T record) throws SQLException;

    <T> List<T> fetch(RecordContract<T> contract, List<QueryFilter> filters, QuerySort sort, Integer limit,
                      Integer offset) throws SQLException;

    default <T> List<T> fetch(RecordContract<T> contract) throws SQLException {
        return fetch(contract, List.of(), null, null, null);
    }

    default <T> List<T> fetch(RecordContract<T> contract, List<QueryFilter> filters) throws SQLException {
        return fetch(contract, filters, null, null, null);
    }

    default <T> List<T> fetch(RecordContract<T> contract, List<QueryFilter> filters, QuerySort sort)
            throws SQLException {
        return fetch(contract, filters, sort, null, null);
    }

    default <T> List<T> fetch(RecordContract<T> contract, List<QueryFilter> filters, QuerySort sort, Integer limit)
            throws SQLException {
        return fetch(contract, filters, sort, limit, null);
    }

    /**
     * Delete the row whose id equals the record's id.
     *
     * @param record record
     * @param <T> record type
     * @throws SQLException on engine errors
     */
    <T extends DatabaseRecord<T>> void delete(T record) throws SQLException;

    <T extends DatabaseRecord<T>> void delete(List<T> records) throws SQLException;

    <T> List<T> read(RecordContract<T> contract, Query query) throws SQLException;

    <T> List<T> read(RecordContract<T> contract, String sql, List<?> arguments) throws SQLException;

    void write(Query query) throws SQLException;

    void write(String sql, List<?> arguments) throws SQLException;

    /**
     * Run a query and return the raw rows without decoding.
     *
     * @param sql SQL with {@code ?} placeholders
     * @param arguments host values, converted by inferred type
     * @return rows
     * @throws SQLException on engine errors
     */
    List<DatabaseRow> fetchRows(String sql, List<?> arguments) throws SQLException;

    @Override
    void close();
}
