package com.fusestorage.exception;

import lombok.Getter;

/**
 * Thrown when a table is created without {@code IF_NOT_EXISTS} and it is already present.
 */
@Getter
public class TableAlreadyExistsException extends FuseStorageException {
    private final String tableName;

    /**
     * Create a new exception.
     *
     * @param tableName table name
     */
    public TableAlreadyExistsException(String tableName) {
        super("Table already exists: " + tableName);
        this.tableName = tableName;
    }
}
