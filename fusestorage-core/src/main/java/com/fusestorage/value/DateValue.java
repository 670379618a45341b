package com.fusestorage.value;

import java.time.Instant;
import java.util.Objects;

/**
 * Point in time; bound by the engine adapter as UTC text.
 */
public record DateValue(Instant value) implements StorageValue {
    public DateValue {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
        return Kind.DATE;
    }

    @Override
    public Object asRawValue() {
        return value;
    }
}
