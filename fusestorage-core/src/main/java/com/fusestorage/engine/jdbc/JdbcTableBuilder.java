package com.fusestorage.engine.jdbc;

import com.fusestorage.engine.TableBuilder;
import com.fusestorage.model.TableOption;
import com.fusestorage.util.StorageDates;
import com.fusestorage.value.BlobValue;
import com.fusestorage.value.BooleanValue;
import com.fusestorage.value.DateValue;
import com.fusestorage.value.IntegerValue;
import com.fusestorage.value.RealValue;
import com.fusestorage.value.StorageValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Collects column declarations and renders the {@code CREATE TABLE} statement.
 */
final class JdbcTableBuilder implements TableBuilder {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private final List<String> columns = new ArrayList<>();

    @Override
    public void column(String name, String sqlType, boolean primaryKey, boolean notNull, boolean unique,
                       StorageValue defaultValue) {
        StringBuilder sb = new StringBuilder(name).append(' ').append(sqlType);
        if (primaryKey) {
            sb.append(" PRIMARY KEY");
        }
        if (notNull) {
            sb.append(" NOT NULL");
        }
        if (unique) {
            sb.append(" UNIQUE");
        }
        if (defaultValue != null) {
            sb.append(" DEFAULT ").append(literal(defaultValue));
        }
        columns.add(sb.toString());
    }

    String toSql(String tableName, Set<TableOption> options) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + tableName + " has no columns");
        }
        StringBuilder sql = new StringBuilder("CREATE ");
        if (options.contains(TableOption.TEMPORARY)) {
            sql.append("TEMP ");
        }
        sql.append("TABLE ");
        if (options.contains(TableOption.IF_NOT_EXISTS)) {
            sql.append("IF NOT EXISTS ");
        }
        sql.append(tableName).append(" (").append(String.join(", ", columns)).append(')');

        List<String> tableOptions = new ArrayList<>(2);
        if (options.contains(TableOption.WITHOUT_ROW_ID)) {
            tableOptions.add("WITHOUT ROWID");
        }
        if (options.contains(TableOption.STRICT)) {
            tableOptions.add("STRICT");
        }
        if (!tableOptions.isEmpty()) {
            sql.append(' ').append(String.join(", ", tableOptions));
        }
        return sql.toString();
    }

    /**
     * SQL literal for a column default.
     *
     * @param value default value
     * @return literal text
     */
    static String literal(StorageValue value) {
        switch (value.kind()) {
            case NULL:
                return "NULL";
            case INTEGER:
                return Long.toString(((IntegerValue) value).value());
            case REAL:
                double d = ((RealValue) value).value();
                return Double.isFinite(d) ? Double.toString(d) : "NULL";
            case BOOLEAN:
                return ((BooleanValue) value).value() ? "1" : "0";
            case DATE:
                return quote(StorageDates.format(((DateValue) value).value()));
            case BLOB:
                return hex(((BlobValue) value).value());
            default:
                return quote(String.valueOf(value.asRawValue()));
        }
    }

    private static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private static String hex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2 + 3).append("X'");
        for (byte b : bytes) {
            sb.append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
        }
        return sb.append('\'').toString();
    }
}
