package com.fusestorage.decoder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fusestorage.engine.DatabaseRow;
import com.fusestorage.exception.DecodingException;
import com.fusestorage.model.ColumnDefinition;
import com.fusestorage.model.TableDefinition;
import com.fusestorage.util.StructuredText;
import com.fusestorage.util.TypeConverter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads typed field values straight out of a row or a flat value map.
 *
 * <p>Columns declared in the table definition are decoded through their declared type. Other columns
 * are decoded with lenient coercion only when inference is enabled. There are no nested containers:
 * arrays, maps and nested objects arrive as structured text and are decoded with Jackson into the
 * requested type.
 */
public final class DirectDecoder {
    private final Map<String, Object> values;
    private final List<String> columns;
    private final TableDefinition tableDefinition;
    private final boolean autoInfer;

    private DirectDecoder(Map<String, Object> values, List<String> columns, TableDefinition tableDefinition,
                          boolean autoInfer) {
        this.values = values;
        this.columns = Collections.unmodifiableList(columns);
        this.tableDefinition = tableDefinition;
        this.autoInfer = autoInfer;
    }

    /**
     * Decoder over a flat field to value map.
     *
     * @param values field values; a key mapped to {@code null} is present but nil
     * @param tableDefinition declared columns, may be {@code null}
     * @param autoInfer use lenient coercion for columns without a declaration
     * @return decoder
     */
    public static DirectDecoder fromValues(Map<String, ?> values, TableDefinition tableDefinition,
                                           boolean autoInfer) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        return new DirectDecoder(copy, new ArrayList<>(copy.keySet()), tableDefinition, autoInfer);
    }

    public static DirectDecoder fromValues(Map<String, ?> values) {
        return fromValues(values, null, true);
    }

    /**
     * Decoder over one result row.
     *
     * @param row result row
     * @param tableDefinition declared columns, may be {@code null}
     * @param autoInfer use lenient coercion for columns without a declaration
     * @return decoder
     */
    public static DirectDecoder fromRow(DatabaseRow row, TableDefinition tableDefinition, boolean autoInfer) {
        List<String> names = row.getColumnNames();
        Map<String, Object> rowValues = new LinkedHashMap<>();
        for (String name : names) {
            rowValues.put(name, row.get(name));
        }
        return new DirectDecoder(rowValues, new ArrayList<>(names), tableDefinition, autoInfer);
    }

    public static DirectDecoder fromRow(DatabaseRow row) {
        return fromRow(row, null, true);
    }

    public List<String> allKeys() {
        return columns;
    }

    public boolean contains(String field) {
        return values.containsKey(field);
    }

    /**
     * True when the field is absent or holds {@code null}.
     *
     * @param field column name
     * @return whether there is no value
     */
    public boolean isNil(String field) {
        return values.get(field) == null;
    }

    public <T> T decode(String field, Class<T> type) {
        return cast(decode(field, StructuredText.mapper().constructType(type)));
    }

    public <T> T decode(String field, TypeReference<T> type) {
        return cast(decode(field, StructuredText.mapper().constructType(type)));
    }

    /**
     * Decode a value that must be present.
     *
     * @param field column name
     * @param type target type
     * @return decoded value, never {@code null}
     * @throws DecodingException {@code KEY_NOT_FOUND} when the column is absent, {@code VALUE_NOT_FOUND} when
     *         it is {@code NULL}, {@code TYPE_MISMATCH} or {@code DATA_CORRUPTED} when it does not convert
     */
    public Object decode(String field, JavaType type) {
        if (!contains(field)) {
            throw error(DecodingException.Kind.KEY_NOT_FOUND, field, type);
        }
        Object decoded = decodePresent(field, type);
        if (decoded == null) {
            throw error(DecodingException.Kind.VALUE_NOT_FOUND, field, type);
        }
        return decoded;
    }

    public <T> T decodeNullable(String field, Class<T> type) {
        return cast(decodeNullable(field, StructuredText.mapper().constructType(type)));
    }

    public <T> T decodeNullable(String field, TypeReference<T> type) {
        return cast(decodeNullable(field, StructuredText.mapper().constructType(type)));
    }

    /**
     * Decode a value that may be absent.
     *
     * @param field column name
     * @param type target type
     * @return decoded value, {@code null} when the column is absent or {@code NULL}
     * @throws DecodingException {@code TYPE_MISMATCH} or {@code DATA_CORRUPTED} when a value does not convert
     */
    public Object decodeNullable(String field, JavaType type) {
        if (!contains(field)) {
            return null;
        }
        return decodePresent(field, type);
    }

    private Object decodePresent(String field, JavaType type) {
        Object raw = values.get(field);
        if (raw == null) {
            return null;
        }

        Optional<ColumnDefinition> declared = tableDefinition != null
                ? tableDefinition.column(field)
                : Optional.empty();
        Object converted;
        if (type.getRawClass() == Object.class) {
            converted = declared.isPresent()
                    ? TypeConverter.naturalValue(raw, declared.get().getType())
                    : raw;
        } else {
            boolean lenient = declared.isPresent() || autoInfer;
            converted = TypeConverter.fromStorageValue(raw, type, lenient);
        }

        if (converted == null) {
            DecodingException.Kind kind = !TypeConverter.isScalarTarget(type.getRawClass()) && raw instanceof String
                    ? DecodingException.Kind.DATA_CORRUPTED
                    : DecodingException.Kind.TYPE_MISMATCH;
            throw error(kind, field, type);
        }
        return converted;
    }

    private DecodingException error(DecodingException.Kind kind, String field, JavaType type) {
        return new DecodingException(kind, field, type.toCanonical(), columns);
    }

    private static <T> T cast(Object value) {
        return (T) value;
    }
}
