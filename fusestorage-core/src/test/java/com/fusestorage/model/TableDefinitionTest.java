package com.fusestorage.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TableDefinitionTest {

    @Test
    void defaultOptions_ifNotExists() {
        TableDefinition def = new TableDefinition("t", List.of(ColumnDefinition.of("a", ColumnType.TEXT)));
        assertEquals(Set.of(TableOption.IF_NOT_EXISTS), def.getOptions());
        assertTrue(def.hasOption(TableOption.IF_NOT_EXISTS));
    }

    @Test
    void duplicateColumn_rejected() {
        var columns = List.of(ColumnDefinition.of("a", ColumnType.TEXT), ColumnDefinition.of("a", ColumnType.INTEGER));
        assertThrows(IllegalArgumentException.class, () -> new TableDefinition("t", columns));
    }

    @Test
    void blankName_rejected() {
        assertThrows(IllegalArgumentException.class, () -> TableDefinition.builder(" ").build());
    }

    @Test
    void columnsAndOptions_areDefensiveCopies() {
        List<ColumnDefinition> columns = new ArrayList<>();
        columns.add(ColumnDefinition.of("a", ColumnType.TEXT));
        EnumSet<TableOption> options = EnumSet.of(TableOption.STRICT);
        TableDefinition def = new TableDefinition("t", columns, options);

        columns.add(ColumnDefinition.of("b", ColumnType.TEXT));
        options.add(TableOption.TEMPORARY);

        assertEquals(List.of("a"), def.columnNames());
        assertEquals(Set.of(TableOption.STRICT), def.getOptions());
        assertThrows(UnsupportedOperationException.class,
                () -> def.getColumns().add(ColumnDefinition.of("c", ColumnType.TEXT)));
        assertThrows(UnsupportedOperationException.class, () -> def.getOptions().add(TableOption.TEMPORARY));
    }

    @Test
    void builder_keepsColumnOrderAndFlags() {
        TableDefinition def = TableDefinition.builder("notes")
                .primaryKey("id", ColumnType.TEXT)
                .notNull("title", ColumnType.TEXT)
                .column("createdAt", ColumnType.DATE)
                .options(TableOption.WITHOUT_ROW_ID)
                .build();

        assertEquals(List.of("id", "title", "createdAt"), def.columnNames());
        assertTrue(def.column("id").orElseThrow().isPrimaryKey());
        assertTrue(def.column("title").orElseThrow().isNotNull());
        assertFalse(def.column("createdAt").orElseThrow().isNotNull());
        assertTrue(def.column("missing").isEmpty());
        assertEquals(Set.of(TableOption.WITHOUT_ROW_ID), def.getOptions());
    }
}
