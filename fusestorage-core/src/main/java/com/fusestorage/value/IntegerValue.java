package com.fusestorage.value;

public record IntegerValue(long value) implements StorageValue {
    @Override
    public Kind kind() {
        return Kind.INTEGER;
    }

    @Override
    public Object asRawValue() {
        return value;
    }
}
