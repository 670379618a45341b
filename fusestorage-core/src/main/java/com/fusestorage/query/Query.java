package com.fusestorage.query;

import java.util.Objects;

/**
 * One database operation: a target table and the action to run on it.
 */
public record Query(String table, QueryAction action) {
    public Query {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Query table is required");
        }
        Objects.requireNonNull(action, "action");
    }

    /**
     * Compile into SQL and positional arguments.
     *
     * @return compiled query
     */
    public CompiledQuery build() {
        return action.compile(table);
    }
}
