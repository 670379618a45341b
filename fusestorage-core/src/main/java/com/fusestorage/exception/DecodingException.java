package com.fusestorage.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown when a single column cannot be decoded into the requested type.
 */
@Getter
public class DecodingException extends FuseStorageException {
    public enum Kind {
        KEY_NOT_FOUND,
        VALUE_NOT_FOUND,
        TYPE_MISMATCH,
        DATA_CORRUPTED
    }

    private final Kind kind;
    private final String field;
    private final String targetType;
    private final List<String> availableColumns;

    /**
     * Create a new exception.
     *
     * @param kind failure kind
     * @param field column name
     * @param targetType name of the requested type
     * @param availableColumns columns present in the source row
     * @param cause underlying cause, may be {@code null}
     */
    public DecodingException(Kind kind, String field, String targetType, List<String> availableColumns,
                             Throwable cause) {
        super(describe(kind, field, targetType, availableColumns), cause);
        this.kind = kind;
        this.field = field;
        this.targetType = targetType;
        this.availableColumns = availableColumns != null ? List.copyOf(availableColumns) : List.of();
    }

    public DecodingException(Kind kind, String field, String targetType, List<String> availableColumns) {
        this(kind, field, targetType, availableColumns, null);
    }

    private static String describe(Kind kind, String field, String targetType, List<String> columns) {
        String what;
        switch (kind) {
            case KEY_NOT_FOUND:
                what = "Column not found";
                break;
            case VALUE_NOT_FOUND:
                what = "Null value for non-nullable";
                break;
            case DATA_CORRUPTED:
                what = "Corrupted structured text in";
                break;
            default:
                what = "Type mismatch for";
                break;
        }
        return what + " field '" + field + "' (target=" + targetType + ", available=" + columns + ")";
    }
}
