package com.fusestorage.record;

import java.util.Collections;
import java.util.Map;

/**
 * Field values decoded from one row, handed to a record creator.
 */
public final class DecodedFields {
    private final Map<String, Object> values;

    DecodedFields(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Decoded value of a field.
     *
     * @param field field name
     * @param <V> field type, as declared in the field table
     * @return value, {@code null} when the column was absent or {@code NULL}
     */
    public <V> V get(String field) {
        if (!values.containsKey(field)) {
            throw new IllegalArgumentException("Unknown field: " + field);
        }
        return (V) values.get(field);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
