package com.fusestorage.value;

import com.fusestorage.model.ColumnType;
import com.fusestorage.util.TypeConverter;

/**
 * A value ready to be bound as a statement parameter.
 *
 * <p>The set of kinds is closed; every binding site switches over {@link Kind} exhaustively.
 */
public sealed interface StorageValue
        permits NullValue, TextValue, IntegerValue, RealValue, BooleanValue, DateValue, BlobValue,
        StructuredTextValue {

    enum Kind {
        NULL,
        TEXT,
        INTEGER,
        REAL,
        BOOLEAN,
        DATE,
        BLOB,
        STRUCTURED_TEXT
    }

    Kind kind();

    /**
     * Canonical raw representation handed to the engine.
     *
     * @return raw value, {@code null} for {@link NullValue}
     */
    Object asRawValue();

    /**
     * Column type a value of this kind is naturally stored as.
     *
     * @return column type
     */
    default ColumnType columnType() {
        switch (kind()) {
            case INTEGER:
                return ColumnType.INTEGER;
            case REAL:
                return ColumnType.REAL;
            case BOOLEAN:
                return ColumnType.BOOLEAN;
            case DATE:
                return ColumnType.DATE;
            case BLOB:
                return ColumnType.BLOB;
            default:
                return ColumnType.TEXT;
        }
    }

    /**
     * Infer the column type of a host value and convert it.
     *
     * @param hostValue any host value, may be {@code null}
     * @return storage value, {@link NullValue} when absent
     */
    static StorageValue of(Object hostValue) {
        if (hostValue instanceof StorageValue sv) {
            return sv;
        }
        var inferred = TypeConverter.inferType(hostValue);
        return TypeConverter.toStorageValue(hostValue, inferred.type(), true);
    }

    static StorageValue ofNull() {
        return NullValue.INSTANCE;
    }
}
