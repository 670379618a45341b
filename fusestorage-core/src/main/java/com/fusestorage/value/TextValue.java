package com.fusestorage.value;

import java.util.Objects;

public record TextValue(String value) implements StorageValue {
    public TextValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
        return Kind.TEXT;
    }

    @Override
    public Object asRawValue() {
        return value;
    }
}
