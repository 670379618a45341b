package com.fusestorage.model;

/**
 * Result of inferring a column type from a runtime value.
 *
 * @param type inferred column type
 * @param optional whether the value was a nullable wrapper (present or empty)
 */
public record InferredType(ColumnType type, boolean optional) {
}
