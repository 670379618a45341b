package com.fusestorage.query;

import com.fusestorage.value.NullValue;
import com.fusestorage.value.StorageValue;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * What a {@link Query} does. Each variant carries everything it needs and compiles on its own.
 *
 * <p>Column lists of insert, update and upsert are emitted in sorted order so the same values always
 * produce the same SQL and argument order.
 */
public sealed interface QueryAction {

    /**
     * Compile against a table.
     *
     * @param table table name
     * @return SQL and arguments
     */
    CompiledQuery compile(String table);

    static Select.SelectBuilder select() {
        return Select.builder();
    }

    static Select selectAll() {
        return Select.builder().build();
    }

    static Insert insert(Map<String, ?> values) {
        return new Insert(toStorageValues(values));
    }

    static InsertMany insertMany(List<? extends Map<String, ?>> rows) {
        List<Map<String, StorageValue>> converted = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            converted.add(toStorageValues(row));
        }
        return new InsertMany(converted);
    }

    static Update update(Map<String, ?> values, List<QueryFilter> filters) {
        return new Update(toStorageValues(values), filters);
    }

    static Delete delete(List<QueryFilter> filters) {
        return new Delete(filters);
    }

    static DeleteMany deleteMany(String field, Collection<?> ids) {
        List<StorageValue> converted = new ArrayList<>(ids.size());
        for (Object id : ids) {
            converted.add(StorageValue.of(id));
        }
        return new DeleteMany(field, converted);
    }

    static Upsert upsert(Map<String, ?> values, List<String> conflict) {
        return new Upsert(toStorageValues(values), conflict, null);
    }

    static Upsert upsert(Map<String, ?> values, List<String> conflict, List<String> update) {
        return new Upsert(toStorageValues(values), conflict, update);
    }

    private static Map<String, StorageValue> toStorageValues(Map<String, ?> values) {
        Map<String, StorageValue> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            out.put(entry.getKey(), StorageValue.of(entry.getValue()));
        }
        return out;
    }

    private static TreeMap<String, StorageValue> sorted(Map<String, StorageValue> values) {
        return new TreeMap<>(values);
    }

    /**
     * {@code SELECT}. No fields selects {@code *}; {@code limit} and {@code offset} are emitted as given.
     */
    @Builder
    record Select(List<String> fields, List<QueryFilter> filters, QuerySort sort, Integer limit, Integer offset)
            implements QueryAction {
        public Select {
            fields = fields != null ? List.copyOf(fields) : List.of();
            filters = filters != null ? List.copyOf(filters) : List.of();
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("limit must not be negative: " + limit);
            }
            if (offset != null && offset < 0) {
                throw new IllegalArgumentException("offset must not be negative: " + offset);
            }
        }

        @Override
        public CompiledQuery compile(String table) {
            List<StorageValue> args = new ArrayList<>();
            StringBuilder sql = new StringBuilder("SELECT ")
                    .append(fields.isEmpty() ? "*" : String.join(", ", fields))
                    .append(" FROM ").append(table)
                    .append(Sql.where(filters, args));
            if (sort != null && !sort.isEmpty()) {
                sql.append(' ').append(sort.compile());
            }
            if (limit != null) {
                sql.append(" LIMIT ").append(limit);
            }
            if (offset != null) {
                sql.append(" OFFSET ").append(offset);
            }
            return new CompiledQuery(sql.toString(), args);
        }
    }

    /**
     * {@code INSERT} of one row. No values inserts a row of defaults.
     */
    record Insert(Map<String, StorageValue> values) implements QueryAction {
        public Insert {
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        }

        @Override
        public CompiledQuery compile(String table) {
            if (values.isEmpty()) {
                return new CompiledQuery("INSERT INTO " + table + " DEFAULT VALUES", List.of());
            }
            TreeMap<String, StorageValue> columns = sorted(values);
            String sql = "INSERT INTO " + table + " (" + String.join(", ", columns.keySet()) + ") VALUES ("
                    + Sql.placeholders(columns.size()) + ")";
            return new CompiledQuery(sql, new ArrayList<>(columns.values()));
        }
    }

    /**
     * Multi-row {@code INSERT}. Columns are the sorted union of every row's keys; a row without a column
     * binds {@code NULL} there.
     */
    record InsertMany(List<Map<String, StorageValue>> rows) implements QueryAction {
        public InsertMany {
            if (rows == null || rows.isEmpty()) {
                throw new IllegalArgumentException("insertMany needs at least one row");
            }
            List<Map<String, StorageValue>> copy = new ArrayList<>(rows.size());
            for (Map<String, StorageValue> row : rows) {
                copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
            }
            rows = Collections.unmodifiableList(copy);
        }

        @Override
        public CompiledQuery compile(String table) {
            TreeSet<String> columns = new TreeSet<>();
            for (Map<String, StorageValue> row : rows) {
                columns.addAll(row.keySet());
            }
            if (columns.isEmpty()) {
                throw new IllegalArgumentException("insertMany rows have no columns");
            }
            String rowPlaceholders = "(" + Sql.placeholders(columns.size()) + ")";
            List<StorageValue> args = new ArrayList<>(columns.size() * rows.size());
            for (Map<String, StorageValue> row : rows) {
                for (String column : columns) {
                    args.add(row.getOrDefault(column, NullValue.INSTANCE));
                }
            }
            String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES "
                    + String.join(", ", Collections.nCopies(rows.size(), rowPlaceholders));
            return new CompiledQuery(sql, args);
        }
    }

    /**
     * {@code UPDATE}; SET arguments come before filter arguments.
     */
    record Update(Map<String, StorageValue> values, List<QueryFilter> filters) implements QueryAction {
        public Update {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("update needs at least one column");
            }
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            filters = filters != null ? List.copyOf(filters) : List.of();
        }

        @Override
        public CompiledQuery compile(String table) {
            TreeMap<String, StorageValue> columns = sorted(values);
            List<StorageValue> args = new ArrayList<>(columns.values());
            String set = columns.keySet().stream().map(c -> c + " = ?").collect(Collectors.joining(", "));
            String sql = "UPDATE " + table + " SET " + set + Sql.where(filters, args);
            return new CompiledQuery(sql, args);
        }
    }

    /**
     * {@code DELETE}. Without filters every row goes.
     */
    record Delete(List<QueryFilter> filters) implements QueryAction {
        public Delete {
            filters = filters != null ? List.copyOf(filters) : List.of();
        }

        @Override
        public CompiledQuery compile(String table) {
            List<StorageValue> args = new ArrayList<>();
            String sql = "DELETE FROM " + table + Sql.where(filters, args);
            return new CompiledQuery(sql, args);
        }
    }

    /**
     * {@code DELETE ... WHERE field IN (...)}, one placeholder per id in input order. No ids deletes nothing.
     */
    record DeleteMany(String field, List<StorageValue> ids) implements QueryAction {
        public DeleteMany {
            if (field == null || field.isBlank()) {
                throw new IllegalArgumentException("deleteMany field is required");
            }
            ids = List.copyOf(ids);
        }

        @Override
        public CompiledQuery compile(String table) {
            List<StorageValue> args = new ArrayList<>(ids.size());
            String sql = "DELETE FROM " + table + Sql.where(List.of(QueryFilter.inSet(field, ids)), args);
            return new CompiledQuery(sql, args);
        }
    }

    /**
     * {@code INSERT ... ON CONFLICT(...) DO UPDATE}. Without an explicit update list every non-conflict
     * column is updated; an empty update set becomes {@code DO NOTHING}.
     */
    record Upsert(Map<String, StorageValue> values, List<String> conflict, List<String> update)
            implements QueryAction {
        public Upsert {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("upsert needs at least one column");
            }
            if (conflict == null || conflict.isEmpty()) {
                throw new IllegalArgumentException("upsert needs at least one conflict column");
            }
            values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
            conflict = List.copyOf(conflict);
            update = update != null ? List.copyOf(update) : null;
        }

        /**
         * Columns assigned in the {@code DO UPDATE SET} clause, sorted.
         *
         * @return update columns
         */
        public List<String> updateColumns() {
            TreeSet<String> columns;
            if (update != null) {
                columns = new TreeSet<>(update);
            } else {
                columns = new TreeSet<>(values.keySet());
                columns.removeAll(conflict);
            }
            return new ArrayList<>(columns);
        }

        @Override
        public CompiledQuery compile(String table) {
            TreeMap<String, StorageValue> columns = sorted(values);
            List<String> updateColumns = updateColumns();
            StringBuilder sql = new StringBuilder("INSERT INTO ").append(table)
                    .append(" (").append(String.join(", ", columns.keySet())).append(") VALUES (")
                    .append(Sql.placeholders(columns.size())).append(") ON CONFLICT(")
                    .append(String.join(", ", conflict)).append(") ");
            if (updateColumns.isEmpty()) {
                sql.append("DO NOTHING");
            } else {
                sql.append("DO UPDATE SET ").append(updateColumns.stream()
                        .map(c -> c + " = excluded." + c)
                        .collect(Collectors.joining(", ")));
            }
            return new CompiledQuery(sql.toString(), new ArrayList<>(columns.values()));
        }
    }
}
