package com.fusestorage.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a whole row cannot be turned into a record.
 */
@Getter
public class ConversionFailedException extends FuseStorageException {
    private final String targetType;
    private final List<String> availableColumns;

    /**
     * Create a new exception.
     *
     * @param targetType record type name
     * @param availableColumns columns present in the source row
     * @param cause underlying cause
     */
    public ConversionFailedException(String targetType, List<String> availableColumns, Throwable cause) {
        this("Failed to convert row to " + targetType + " (available=" + availableColumns + "): "
                + (cause != null ? cause.getMessage() : "unknown"), targetType, availableColumns, cause);
    }

    /**
     * Create a new exception with an explicit message.
     *
     * @param message error message
     * @param targetType record type name
     * @param availableColumns columns present in the source row
     * @param cause underlying cause
     */
    public ConversionFailedException(String message, String targetType, List<String> availableColumns,
                                     Throwable cause) {
        super(message, cause);
        this.targetType = targetType;
        this.availableColumns = availableColumns != null ? List.copyOf(availableColumns) : List.of();
    }
}
