package com.fusestorage.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ColumnTypeTest {

    @Test
    void sqlType_dateIsDatetime() {
        assertEquals("DATETIME", ColumnType.DATE.sqlType());
        assertEquals("TEXT", ColumnType.TEXT.sqlType());
        assertEquals("BLOB", ColumnType.BLOB.sqlType());
    }

    @Test
    void strictSqlType_usesOnlyStrictTableTypes() {
        Set<String> allowed = Set.of("INT", "INTEGER", "REAL", "TEXT", "BLOB", "ANY");
        for (ColumnType type : ColumnType.values()) {
            assertTrue(allowed.contains(type.strictSqlType()), type.name());
        }
        assertEquals("TEXT", ColumnType.DATE.strictSqlType());
        assertEquals("INTEGER", ColumnType.BOOLEAN.strictSqlType());
        assertEquals("REAL", ColumnType.DOUBLE.strictSqlType());
        assertEquals("ANY", ColumnType.NUMERIC.strictSqlType());
    }

    @Test
    void fromSqlType_roundTripsCanonicalNames() {
        for (ColumnType type : ColumnType.values()) {
            assertEquals(type, ColumnType.fromSqlType(type.sqlType()), type.name());
        }
    }

    @Test
    void fromSqlType_matchesSubstringIgnoringCase() {
        assertEquals(ColumnType.INTEGER, ColumnType.fromSqlType("unsigned integer"));
        assertEquals(ColumnType.DOUBLE, ColumnType.fromSqlType("double precision"));
        assertEquals(ColumnType.NUMERIC, ColumnType.fromSqlType("NUMERIC(10,2)"));
        assertEquals(ColumnType.DATE, ColumnType.fromSqlType("date"));
        assertEquals(ColumnType.TEXT, ColumnType.fromSqlType("LONGTEXT"));
    }

    @Test
    void fromSqlType_unknownFallsBackToText() {
        assertEquals(ColumnType.TEXT, ColumnType.fromSqlType("VARCHAR(20)"));
        assertEquals(ColumnType.TEXT, ColumnType.fromSqlType(""));
        assertEquals(ColumnType.TEXT, ColumnType.fromSqlType(null));
    }
}
