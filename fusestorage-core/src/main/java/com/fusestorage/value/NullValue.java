package com.fusestorage.value;

/**
 * Explicit SQL {@code NULL}.
 */
public final class NullValue implements StorageValue {
    public static final NullValue INSTANCE = new NullValue();

    private NullValue() {
    }

    @Override
    public Kind kind() {
        return Kind.NULL;
    }

    @Override
    public Object asRawValue() {
        return null;
    }

    @Override
    public String toString() {
        return "NULL";
    }
}
