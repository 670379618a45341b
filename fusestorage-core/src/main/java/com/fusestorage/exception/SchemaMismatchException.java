package com.fusestorage.exception;

import com.fusestorage.model.ColumnType;
import lombok.Getter;

/**
 * Thrown on write when a value does not fit its declared column, or a required column has no value.
 */
@Getter
public class SchemaMismatchException extends FuseStorageException {
    private final ColumnType columnType;
    private final String valueType;

    /**
     * Create a new exception.
     *
     * @param columnType declared column type
     * @param valueType runtime type of the offending value, {@code null} when the value was absent
     * @param message error message
     */
    public SchemaMismatchException(ColumnType columnType, String valueType, String message) {
        super(message);
        this.columnType = columnType;
        this.valueType = valueType;
    }

    public static SchemaMismatchException missingValue(ColumnType columnType) {
        return new SchemaMismatchException(columnType, null,
                "Required " + columnType + " column has no value");
    }

    public static SchemaMismatchException incompatible(ColumnType columnType, Object value) {
        String valueType = value.getClass().getName();
        return new SchemaMismatchException(columnType, valueType,
                "Cannot store " + valueType + " in " + columnType + " column");
    }
}
