package com.fusestorage.decoder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fusestorage.Address;
import com.fusestorage.engine.MapDatabaseRow;
import com.fusestorage.exception.DecodingException;
import com.fusestorage.model.ColumnType;
import com.fusestorage.model.TableDefinition;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DirectDecoderTest {
    private static final TableDefinition TABLE = TableDefinition.builder("things")
            .primaryKey("id", ColumnType.TEXT)
            .column("count", ColumnType.INTEGER)
            .column("seen", ColumnType.DATE)
            .build();

    private static Map<String, Object> row() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("id", "t-1");
        values.put("count", "12");
        values.put("seen", "2024-03-05 10:15:30.000");
        values.put("note", null);
        values.put("address", "{\"street\":\"Main\",\"city\":\"Springfield\",\"zip\":12345}");
        values.put("tags", "[\"a\",\"b\"]");
        return values;
    }

    @Test
    void keys_presenceAndNil() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        assertEquals(List.of("id", "count", "seen", "note", "address", "tags"), decoder.allKeys());
        assertTrue(decoder.contains("note"));
        assertTrue(decoder.isNil("note"));
        assertFalse(decoder.contains("missing"));
        assertTrue(decoder.isNil("missing"));
        assertFalse(decoder.isNil("id"));
    }

    @Test
    void decode_missingColumnIsKeyNotFound() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        DecodingException e = assertThrows(DecodingException.class, () -> decoder.decode("missing", String.class));
        assertEquals(DecodingException.Kind.KEY_NOT_FOUND, e.getKind());
        assertEquals("missing", e.getField());
        assertEquals(List.of("id", "count", "seen", "note", "address", "tags"), e.getAvailableColumns());
    }

    @Test
    void decode_nullIsValueNotFound() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        DecodingException e = assertThrows(DecodingException.class, () -> decoder.decode("note", String.class));
        assertEquals(DecodingException.Kind.VALUE_NOT_FOUND, e.getKind());
    }

    @Test
    void decode_unconvertibleScalarIsTypeMismatch() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        DecodingException e = assertThrows(DecodingException.class, () -> decoder.decode("id", Long.class));
        assertEquals(DecodingException.Kind.TYPE_MISMATCH, e.getKind());
        assertEquals("java.lang.Long", e.getTargetType());
    }

    @Test
    void decode_outOfRangeDateIsTypeMismatch() {
        DirectDecoder decoder = DirectDecoder.fromValues(Map.of("seen", Long.MAX_VALUE), TABLE, false);
        DecodingException e = assertThrows(DecodingException.class, () -> decoder.decode("seen", Instant.class));
        assertEquals(DecodingException.Kind.TYPE_MISMATCH, e.getKind());
        assertNull(decoder.decodeNullable("missing", Instant.class));
    }

    @Test
    void decode_badStructuredTextIsDataCorrupted() {
        Map<String, Object> values = new HashMap<>();
        values.put("address", "{\"street\":");
        DirectDecoder decoder = DirectDecoder.fromValues(values);
        DecodingException e = assertThrows(DecodingException.class,
                () -> decoder.decode("address", Address.class));
        assertEquals(DecodingException.Kind.DATA_CORRUPTED, e.getKind());
    }

    @Test
    void decode_structuredText() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        assertEquals(new Address("Main", "Springfield", 12345), decoder.decode("address", Address.class));
        assertEquals(List.of("a", "b"), decoder.decode("tags", new TypeReference<List<String>>() { }));
    }

    @Test
    void decode_declaredColumnsAreLenient() {
        DirectDecoder decoder = DirectDecoder.fromValues(row(), TABLE, false);
        assertEquals(12L, decoder.decode("count", Long.class));
        assertEquals(12, decoder.decode("count", int.class));
    }

    @Test
    void decode_undeclaredColumnsFollowInference() {
        Map<String, Object> values = Map.of("extra", "7");
        assertEquals(7L, DirectDecoder.fromValues(values, TABLE, true).decode("extra", Long.class));

        DirectDecoder strict = DirectDecoder.fromValues(values, TABLE, false);
        DecodingException e = assertThrows(DecodingException.class, () -> strict.decode("extra", Long.class));
        assertEquals(DecodingException.Kind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    void decode_objectTargetUsesDeclaredColumnType() {
        DirectDecoder decoder = DirectDecoder.fromValues(row(), TABLE, false);
        assertEquals(Instant.parse("2024-03-05T10:15:30Z"), decoder.decode("seen", Object.class));
        assertEquals(12L, decoder.decode("count", Object.class));
        assertEquals("[\"a\",\"b\"]", decoder.decode("tags", Object.class));
    }

    @Test
    void decodeNullable_absentOrNullIsNull() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        assertNull(decoder.decodeNullable("missing", String.class));
        assertNull(decoder.decodeNullable("note", String.class));
        assertEquals("t-1", decoder.decodeNullable("id", String.class));
    }

    @Test
    void decodeNullable_stillRejectsMismatches() {
        DirectDecoder decoder = DirectDecoder.fromValues(row());
        DecodingException e = assertThrows(DecodingException.class,
                () -> decoder.decodeNullable("id", Boolean.class));
        assertEquals(DecodingException.Kind.TYPE_MISMATCH, e.getKind());
    }

    @Test
    void fromRow_keepsColumnOrder() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("b", 1L);
        values.put("a", 2L);
        DirectDecoder decoder = DirectDecoder.fromRow(new MapDatabaseRow(values));
        assertEquals(List.of("b", "a"), decoder.allKeys());
        assertEquals(2, decoder.decode("a", Integer.class));
    }
}
