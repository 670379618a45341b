package com.fusestorage.query;

import com.fusestorage.value.StorageValue;

import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the positional arguments that fill them.
 */
public record CompiledQuery(String sql, List<StorageValue> arguments) {
    public CompiledQuery {
        arguments = List.copyOf(arguments);
    }
}
