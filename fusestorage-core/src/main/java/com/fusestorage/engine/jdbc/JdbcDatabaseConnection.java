package com.fusestorage.engine.jdbc;

import com.fusestorage.engine.DatabaseConnection;
import com.fusestorage.engine.DatabaseRow;
import com.fusestorage.engine.MapDatabaseRow;
import com.fusestorage.engine.TableBuilderBody;
import com.fusestorage.model.TableOption;
import com.fusestorage.util.JdbcValues;
import com.fusestorage.util.StorageDates;
import com.fusestorage.value.BlobValue;
import com.fusestorage.value.BooleanValue;
import com.fusestorage.value.DateValue;
import com.fusestorage.value.IntegerValue;
import com.fusestorage.value.RealValue;
import com.fusestorage.value.StorageValue;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link DatabaseConnection} over one borrowed JDBC connection.
 */
@Slf4j
class JdbcDatabaseConnection implements DatabaseConnection {
    private final Connection connection;

    JdbcDatabaseConnection(Connection connection) {
        this.connection = connection;
    }

    @Override
    public void execute(String sql, List<StorageValue> arguments) throws SQLException {
        log.debug("Execute: {} ({} args)", sql, arguments.size());
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, arguments);
            ps.execute();
        }
    }

    @Override
    public boolean tableExists(String tableName) throws SQLException {
        DatabaseMetaData meta = connection.getMetaData();
        // Engines fold unquoted identifiers differently; metadata patterns are case-sensitive on some.
        Set<String> candidates = new LinkedHashSet<>(List.of(
                tableName, tableName.toLowerCase(Locale.ROOT), tableName.toUpperCase(Locale.ROOT)));
        for (String candidate : candidates) {
            try (ResultSet rs = meta.getTables(null, null, candidate, null)) {
                while (rs.next()) {
                    // the name argument is a LIKE pattern, so '_' and '%' may over-match
                    if (tableName.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                        return true;
                    }
                }
            }
        }
        return false;
    }

    @Override
    public void createTable(String tableName, Set<TableOption> options, TableBuilderBody body) throws SQLException {
        JdbcTableBuilder builder = new JdbcTableBuilder();
        body.build(builder);
        String sql = builder.toSql(tableName, options);
        execute(sql, List.of());
        log.info("Created table {}", tableName);
    }

    @Override
    public List<DatabaseRow> fetchRows(String sql, List<StorageValue> arguments) throws SQLException {
        log.debug("Query: {} ({} args)", sql, arguments.size());
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            bind(ps, arguments);
            try (ResultSet rs = ps.executeQuery()) {
                ResultSetMetaData md = rs.getMetaData();
                int columnCount = md.getColumnCount();
                List<String> labels = new ArrayList<>(columnCount);
                for (int i = 1; i <= columnCount; i++) {
                    labels.add(md.getColumnLabel(i));
                }

                List<DatabaseRow> rows = new ArrayList<>();
                while (rs.next()) {
                    Map<String, Object> values = new LinkedHashMap<>();
                    for (int i = 1; i <= columnCount; i++) {
                        values.put(labels.get(i - 1), JdbcValues.readValue(rs, i));
                    }
                    rows.add(new MapDatabaseRow(values));
                }
                log.debug("Fetched {} rows", rows.size());
                return rows;
            }
        }
    }

    static void bind(PreparedStatement ps, List<StorageValue> arguments) throws SQLException {
        for (int i = 0; i < arguments.size(); i++) {
            bind(ps, i + 1, arguments.get(i));
        }
    }

    private static void bind(PreparedStatement ps, int index, StorageValue value) throws SQLException {
        switch (value.kind()) {
            case NULL:
                ps.setNull(index, Types.NULL);
                break;
            case INTEGER:
                ps.setLong(index, ((IntegerValue) value).value());
                break;
            case REAL:
                ps.setDouble(index, ((RealValue) value).value());
                break;
            case BOOLEAN:
                ps.setBoolean(index, ((BooleanValue) value).value());
                break;
            case DATE:
                ps.setString(index, StorageDates.format(((DateValue) value).value()));
                break;
            case BLOB:
                ps.setBytes(index, ((BlobValue) value).value());
                break;
            default:
                ps.setString(index, (String) value.asRawValue());
                break;
        }
    }
}
