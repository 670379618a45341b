package com.fusestorage.engine;

import com.fusestorage.value.StorageValue;

/**
 * Receives column declarations while a table is being created.
 */
public interface TableBuilder {
    /**
     * Declare a column.
     *
     * @param name column name
     * @param sqlType engine type name
     * @param primaryKey whether the column is the primary key
     * @param notNull whether the column rejects {@code NULL}
     * @param unique whether the column carries a unique constraint
     * @param defaultValue default value, {@code null} for none
     */
    void column(String name, String sqlType, boolean primaryKey, boolean notNull, boolean unique,
                StorageValue defaultValue);
}
