package com.fusestorage.value;

import java.util.Objects;

/**
 * JSON text holding an array, map or nested object stored in a single text column.
 */
public record StructuredTextValue(String json) implements StorageValue {
    public StructuredTextValue {
        Objects.requireNonNull(json, "json");
    }

    @Override
    public Kind kind() {
        return Kind.STRUCTURED_TEXT;
    }

    @Override
    public Object asRawValue() {
        return json;
    }
}
