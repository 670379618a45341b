package com.fusestorage.service;

import com.fusestorage.config.DatabaseSettings;
import com.fusestorage.config.DatabaseSettingsLoader;
import com.fusestorage.engine.DatabaseFactory;
import com.fusestorage.engine.DatabaseFactoryRegistry;
import com.fusestorage.engine.DatabaseQueue;
import com.fusestorage.engine.DatabaseRow;
import com.fusestorage.exception.ConversionFailedException;
import com.fusestorage.exception.FuseStorageException;
import com.fusestorage.exception.TableAlreadyExistsException;
import com.fusestorage.model.ColumnDefinition;
import com.fusestorage.model.TableDefinition;
import com.fusestorage.model.TableOption;
import com.fusestorage.query.CompiledQuery;
import com.fusestorage.query.Query;
import com.fusestorage.query.QueryAction;
import com.fusestorage.query.QueryFilter;
import com.fusestorage.query.QuerySort;
import com.fusestorage.record.DatabaseRecord;
import com.fusestorage.record.RecordContract;
import com.fusestorage.util.TypeConverter;
import com.fusestorage.value.StorageValue;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link DatabaseManageable} over a {@link DatabaseQueue}.
 *
 * <p>Every operation compiles one statement and submits it in one read or write unit. The manager owns the
 * queue and closes it in {@link #close()}.
 */
@Slf4j
public class DatabaseManager implements DatabaseManageable {
    private final DatabaseQueue queue;

    /**
     * Create a manager over an existing queue.
     *
     * @param queue database queue
     */
    public DatabaseManager(DatabaseQueue queue) {
        if (queue == null) {
            throw new IllegalArgumentException("queue is required");
        }
        this.queue = queue;
    }

    /**
     * Open a manager through the registered {@link DatabaseFactory}.
     *
     * @param settings database settings
     * @return manager
     * @throws com.fusestorage.exception.NoFactoryRegisteredException when no factory is registered
     * @throws SQLException when the database cannot be opened
     */
    public static DatabaseManager open(DatabaseSettings settings) throws SQLException {
        return open(DatabaseFactoryRegistry.require(), settings);
    }

    /**
     * Open a manager through the registered factory with settings from {@link DatabaseSettingsLoader#load()}.
     *
     * @return manager
     * @throws SQLException when the database cannot be opened
     */
    public static DatabaseManager open() throws SQLException {
        return open(DatabaseSettingsLoader.load());
    }

    public static DatabaseManager open(DatabaseFactory factory, DatabaseSettings settings) throws SQLException {
        return new DatabaseManager(factory.createDatabaseQueue(settings));
    }

    @Override
    public boolean tableExists(String tableName) throws SQLException {
        return queue.read(db -> db.tableExists(tableName));
    }

    @Override
    public void createTable(TableDefinition definition) throws SQLException {
        queue.write(db -> {
            if (db.tableExists(definition.getName()) && !definition.hasOption(TableOption.IF_NOT_EXISTS)) {
                throw new TableAlreadyExistsException(definition.getName());
            }
            boolean strict = definition.hasOption(TableOption.STRICT);
            db.createTable(definition.getName(), definition.getOptions(), table -> {
                for (ColumnDefinition column : definition.getColumns()) {
                    StorageValue defaultValue = column.getDefaultValue() != null
                            ? TypeConverter.toStorageValue(column.getDefaultValue(), column.getType(), true)
                            : null;
                    String sqlType = strict ? column.getType().strictSqlType() : column.getType().sqlType();
                    table.column(column.getName(), sqlType, column.isPrimaryKey(),
                            column.isNotNull(), column.isUnique(), defaultValue);
                }
            });
            return null;
        });
    }

    @Override
    public <T extends DatabaseRecord<T>> void add(T record) throws SQLException {
        RecordContract<T> contract = record.contract();
        write(new Query(contract.getTableName(), QueryAction.insert(contract.toStorageValues(record))));
    }

    @Override
    public <T extends DatabaseRecord<T>> void add(List<T> records) throws SQLException {
        if (records.isEmpty()) {
            return;
        }
        RecordContract<T> contract = records.get(0).contract();
        List<Map<String, StorageValue>> rows = new ArrayList<>(records.size());
        for (T record : records) {
            rows.add(contract.toStorageValues(record));
        }
        write(new Query(contract.getTableName(), QueryAction.insertMany(rows)));
    }

    @Override
    public <T extends DatabaseRecord<T>> void upsert(T record) throws SQLException {
        RecordContract<T> contract = record.contract();
        write(new Query(contract.getTableName(),
                QueryAction.upsert(contract.toStorageValues(record), List.of(contract.getIdField()))));
    }

    @Override
    public <T> List<T> fetch(RecordContract<T> contract, List<QueryFilter> filters, QuerySort sort, Integer limit,
                             Integer offset) throws SQLException {
        QueryAction select = QueryAction.select()
                .filters(filters)
                .sort(sort)
                .limit(limit)
                .offset(offset)
                .build();
        return read(contract, new Query(contract.getTableName(), select));
    }

    @Override
    public <T extends DatabaseRecord<T>> void delete(T record) throws SQLException {
        RecordContract<T> contract = record.contract();
        QueryFilter byId = QueryFilter.equalTo(contract.getIdField(), contract.idValue(record));
        write(new Query(contract.getTableName(), QueryAction.delete(List.of(byId))));
    }

    @Override
    public <T extends DatabaseRecord<T>> void delete(List<T> records) throws SQLException {
        if (records.isEmpty()) {
            return;
        }
        RecordContract<T> contract = records.get(0).contract();
        List<StorageValue> ids = new ArrayList<>(records.size());
        for (T record : records) {
            ids.add(contract.idValue(record));
        }
        write(new Query(contract.getTableName(), QueryAction.deleteMany(contract.getIdField(), ids)));
    }

    @Override
    public <T> List<T> read(RecordContract<T> contract, Query query) throws SQLException {
        CompiledQuery compiled = query.build();
        return decodeAll(contract, queue.read(db -> db.fetchRows(compiled.sql(), compiled.arguments())));
    }

    @Override
    public <T> List<T> read(RecordContract<T> contract, String sql, List<?> arguments) throws SQLException {
        List<StorageValue> args = toArguments(arguments);
        return decodeAll(contract, queue.read(db -> db.fetchRows(sql, args)));
    }

    @Override
    public void write(Query query) throws SQLException {
        CompiledQuery compiled = query.build();
        queue.write(db -> {
            db.execute(compiled.sql(), compiled.arguments());
            return null;
        });
    }

    @Override
    public void write(String sql, List<?> arguments) throws SQLException {
        List<StorageValue> args = toArguments(arguments);
        queue.write(db -> {
            db.execute(sql, args);
            return null;
        });
    }

    @Override
    public List<DatabaseRow> fetchRows(String sql, List<?> arguments) throws SQLException {
        List<StorageValue> args = toArguments(arguments);
        return queue.read(db -> db.fetchRows(sql, args));
    }

    @Override
    public void close() {
        queue.close();
    }

    private static <T> List<T> decodeAll(RecordContract<T> contract, List<DatabaseRow> rows) {
        List<T> out = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            DatabaseRow row = rows.get(i);
            try {
                out.add(contract.fromStorage(row));
            } catch (FuseStorageException e) {
                throw new ConversionFailedException(
                        "Failed to decode row " + i + " as " + contract.getRecordType().getName()
                                + " (columns=" + row.getColumnNames() + "): " + e.getMessage(),
                        contract.getRecordType().getName(), row.getColumnNames(), e);
            }
        }
        return out;
    }

    private static List<StorageValue> toArguments(List<?> arguments) {
        if (arguments == null) {
            return List.of();
        }
        List<StorageValue> out = new ArrayList<>(arguments.size());
        for (Object argument : arguments) {
            out.add(StorageValue.of(argument));
        }
        return out;
    }
}
