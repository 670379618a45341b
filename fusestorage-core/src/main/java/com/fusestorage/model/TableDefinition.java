package com.fusestorage.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable schema of one table: name, ordered columns and creation options.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class TableDefinition {
    private final String name;
    private final List<ColumnDefinition> columns;
    private final Set<TableOption> options;

    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, ColumnDefinition> columnsByName;

    /**
     * Create a table definition.
     *
     * @param name table name
     * @param columns ordered columns; names must be unique
     * @param options creation options
     */
    public TableDefinition(String name, List<ColumnDefinition> columns, Set<TableOption> options) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Table name is required");
        }
        this.name = name;

        Map<String, ColumnDefinition> byName = new LinkedHashMap<>();
        for (ColumnDefinition column : columns != null ? columns : List.<ColumnDefinition>of()) {
            if (byName.putIfAbsent(column.getName(), column) != null) {
                throw new IllegalArgumentException(
                        "Duplicate column '" + column.getName() + "' in table definition: " + name);
            }
        }
        this.columnsByName = Collections.unmodifiableMap(byName);
        this.columns = List.copyOf(byName.values());

        EnumSet<TableOption> copy = EnumSet.noneOf(TableOption.class);
        if (options != null) {
            copy.addAll(options);
        }
        this.options = Collections.unmodifiableSet(copy);
    }

    /**
     * Create a table definition with the default {@link TableOption#IF_NOT_EXISTS} option.
     *
     * @param name table name
     * @param columns ordered columns
     */
    public TableDefinition(String name, List<ColumnDefinition> columns) {
        this(name, columns, EnumSet.of(TableOption.IF_NOT_EXISTS));
    }

    public Optional<ColumnDefinition> column(String columnName) {
        return Optional.ofNullable(columnsByName.get(columnName));
    }

    public boolean hasOption(TableOption option) {
        return options.contains(option);
    }

    public List<String> columnNames() {
        return new ArrayList<>(columnsByName.keySet());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Fluent builder; options start out as {@code IF_NOT_EXISTS} unless replaced.
     */
    public static final class Builder {
        private final String name;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private final EnumSet<TableOption> options = EnumSet.of(TableOption.IF_NOT_EXISTS);

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(ColumnDefinition column) {
            columns.add(column);
            return this;
        }

        public Builder column(String columnName, ColumnType type) {
            return column(ColumnDefinition.of(columnName, type));
        }

        public Builder primaryKey(String columnName, ColumnType type) {
            return column(ColumnDefinition.builder().name(columnName).type(type).primaryKey(true).build());
        }

        public Builder notNull(String columnName, ColumnType type) {
            return column(ColumnDefinition.builder().name(columnName).type(type).notNull(true).build());
        }

        public Builder options(TableOption... newOptions) {
            options.clear();
            Collections.addAll(options, newOptions);
            return this;
        }

        public TableDefinition build() {
            return new TableDefinition(name, columns, options);
        }
    }
}
