package com.fusestorage.engine;

import java.util.List;

/**
 * One result row, addressable by column name.
 */
public interface DatabaseRow {
    /**
     * Raw value of a column.
     *
     * @param column column name
     * @return raw value, {@code null} for SQL NULL or an unknown column
     */
    Object get(String column);

    /**
     * Column names in result order.
     *
     * @return column names
     */
    List<String> getColumnNames();

    default boolean hasColumn(String column) {
        return getColumnNames().contains(column);
    }
}
