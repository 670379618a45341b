package com.fusestorage.model;

/**
 * Options applied when a table is created.
 */
public enum TableOption {
    IF_NOT_EXISTS,
    TEMPORARY,
    WITHOUT_ROW_ID,
    /**
     * SQLite strict typing. Columns are declared with {@link ColumnType#strictSqlType()}, since the engine only
     * accepts INT, INTEGER, REAL, TEXT, BLOB and ANY there.
     */
    STRICT
}
