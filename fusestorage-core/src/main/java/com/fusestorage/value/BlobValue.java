package com.fusestorage.value;

import java.util.Arrays;
import java.util.Objects;

public record BlobValue(byte[] value) implements StorageValue {
    public BlobValue {
        Objects.requireNonNull(value, "value");
        value = value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public Kind kind() {
        return Kind.BLOB;
    }

    @Override
    public Object asRawValue() {
        return value.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BlobValue other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "BlobValue[" + value.length + " bytes]";
    }
}
