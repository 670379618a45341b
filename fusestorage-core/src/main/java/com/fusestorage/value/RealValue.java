package com.fusestorage.value;

public record RealValue(double value) implements StorageValue {
    @Override
    public Kind kind() {
        return Kind.REAL;
    }

    @Override
    public Object asRawValue() {
        return value;
    }
}
