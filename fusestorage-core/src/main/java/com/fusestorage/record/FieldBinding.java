package com.fusestorage.record;

import com.fasterxml.jackson.databind.JavaType;
import lombok.Getter;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * One entry of a record's field table: name, declared Java type and accessors.
 *
 * @param <T> record type
 */
@Getter
public final class FieldBinding<T> {
    private final String name;
    private final JavaType type;
    private final boolean nullable;
    @Getter(lombok.AccessLevel.NONE)
    private final Function<T, ?> getter;
    @Getter(lombok.AccessLevel.NONE)
    private final BiConsumer<T, Object> setter;

    FieldBinding(String name, JavaType type, boolean nullable, Function<T, ?> getter, BiConsumer<T, Object> setter) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
        this.getter = getter;
        this.setter = setter;
    }

    public Object read(T record) {
        return getter.apply(record);
    }

    boolean isWritable() {
        return setter != null;
    }

    void write(T record, Object value) {
        setter.accept(record, value);
    }

    @Override
    public String toString() {
        return name + ":" + type.toCanonical();
    }
}
