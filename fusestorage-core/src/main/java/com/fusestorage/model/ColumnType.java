package com.fusestorage.model;

import java.util.Locale;

/**
 * Storage types a column can be declared with.
 *
 * <p>The mapping from host values to column types is total: anything the converter does not
 * recognize is stored as {@link #TEXT}.
 */
public enum ColumnType {
    TEXT("TEXT", "TEXT"),
    INTEGER("INTEGER", "INTEGER"),
    REAL("REAL", "REAL"),
    DOUBLE("DOUBLE", "REAL"),
    NUMERIC("NUMERIC", "ANY"),
    BOOLEAN("BOOLEAN", "INTEGER"),
    DATE("DATETIME", "TEXT"),
    BLOB("BLOB", "BLOB"),
    ANY("ANY", "ANY");

    private final String sqlType;
    private final String strictSqlType;

    ColumnType(String sqlType, String strictSqlType) {
        this.sqlType = sqlType;
        this.strictSqlType = strictSqlType;
    }

    /**
     * Canonical engine type name used in {@code CREATE TABLE}.
     *
     * @return engine type name
     */
    public String sqlType() {
        return sqlType;
    }

    /**
     * Type name for tables created with {@code STRICT}, which only accept {@code INT}, {@code INTEGER},
     * {@code REAL}, {@code TEXT}, {@code BLOB} and {@code ANY}. Dates are stored as text and booleans as 0/1,
     * matching what the converter writes.
     *
     * @return engine type name valid in a strict table
     */
    public String strictSqlType() {
        return strictSqlType;
    }

    /**
     * Best-effort reverse mapping of an engine type name. The first constant, in declaration order, whose
     * name occurs in the upper-cased input wins.
     *
     * @param engineType engine type name, e.g. {@code VARCHAR(20)} or {@code DATETIME}
     * @return matching column type, {@link #TEXT} when nothing matches
     */
    public static ColumnType fromSqlType(String engineType) {
        if (engineType == null) {
            return TEXT;
        }
        String v = engineType.trim().toUpperCase(Locale.ROOT);
        for (ColumnType candidate : values()) {
            if (v.contains(candidate.name())) {
                return candidate;
            }
        }
        return TEXT;
    }
}
