package com.fusestorage.value;

public record BooleanValue(boolean value) implements StorageValue {
    @Override
    public Kind kind() {
        return Kind.BOOLEAN;
    }

    @Override
    public Object asRawValue() {
        return value;
    }
}
