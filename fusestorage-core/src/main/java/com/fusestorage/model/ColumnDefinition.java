package com.fusestorage.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One column of a {@link TableDefinition}.
 */
@Value
@Builder(toBuilder = true)
public class ColumnDefinition {
    @NonNull
    String name;
    @NonNull
    ColumnType type;
    boolean primaryKey;
    boolean notNull;
    boolean unique;
    /**
     * Host value used as the column's {@code DEFAULT}; converted with the column's type.
     */
    Object defaultValue;

    /**
     * Shorthand for a plain nullable column.
     *
     * @param name column name
     * @param type column type
     * @return column definition
     */
    public static ColumnDefinition of(String name, ColumnType type) {
        return builder().name(name).type(type).build();
    }
}
