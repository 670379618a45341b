package com.fusestorage.exception;

/**
 * Base type of all errors raised by the storage layer itself.
 *
 * <p>Engine I/O failures are not wrapped; they surface as {@link java.sql.SQLException}.
 */
public class FuseStorageException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public FuseStorageException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a cause.
     *
     * @param message error message
     * @param cause underlying cause
     */
    public FuseStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
