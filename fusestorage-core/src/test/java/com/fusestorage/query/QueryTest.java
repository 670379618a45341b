package com.fusestorage.query;

import com.fusestorage.value.BooleanValue;
import com.fusestorage.value.IntegerValue;
import com.fusestorage.value.NullValue;
import com.fusestorage.value.StorageValue;
import com.fusestorage.value.TextValue;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryTest {

    private static CompiledQuery compile(QueryAction action) {
        return new Query("items", action).build();
    }

    private static List<StorageValue> args(Object... values) {
        StorageValue[] out = new StorageValue[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = StorageValue.of(values[i]);
        }
        return List.of(out);
    }

    @Test
    void selectAll_selectsStar() {
        CompiledQuery q = compile(QueryAction.selectAll());
        assertEquals("SELECT * FROM items", q.sql());
        assertEquals(List.of(), q.arguments());
    }

    @Test
    void select_withEverything() {
        CompiledQuery q = compile(QueryAction.select()
                .fields(List.of("id", "name"))
                .filters(List.of(QueryFilter.equalTo("done", true), QueryFilter.like("name", "%milk%")))
                .sort(QuerySort.descending("createdAt").then("name", SortOrder.ASCENDING))
                .limit(10)
                .offset(20)
                .build());
        assertEquals("SELECT id, name FROM items WHERE done = ? AND name LIKE ? "
                + "ORDER BY createdAt DESC, name ASC LIMIT 10 OFFSET 20", q.sql());
        assertEquals(List.of(new BooleanValue(true), new TextValue("%milk%")), q.arguments());
    }

    @Test
    void select_offsetWithoutLimitIsEmittedAsGiven() {
        CompiledQuery q = compile(QueryAction.select().offset(5).build());
        assertEquals("SELECT * FROM items OFFSET 5", q.sql());
    }

    @Test
    void select_rejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> QueryAction.select().limit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> QueryAction.select().offset(-1).build());
    }

    @Test
    void filters_everyOperator() {
        CompiledQuery q = compile(QueryAction.select().filters(List.of(
                QueryFilter.equalTo("a", 1),
                QueryFilter.notEqualTo("b", "x"),
                QueryFilter.greaterThan("c", 2),
                QueryFilter.lessThan("d", 3),
                QueryFilter.inSet("e", List.of(4, 5, 6)))).build());
        assertEquals("SELECT * FROM items WHERE a = ? AND b != ? AND c > ? AND d < ? AND e IN (?, ?, ?)", q.sql());
        assertEquals(args(1, "x", 2, 3, 4, 5, 6), q.arguments());
    }

    @Test
    void filters_emptyInSetMatchesNothing() {
        CompiledQuery q = compile(QueryAction.select()
                .filters(List.of(QueryFilter.inSet("id", List.of()), QueryFilter.equalTo("a", 1)))
                .build());
        assertEquals("SELECT * FROM items WHERE 1=0 AND a = ?", q.sql());
        assertEquals(args(1), q.arguments());
    }

    @Test
    void filters_nullValueBindsNull() {
        QueryFilter filter = QueryFilter.equalTo("a", null);
        assertEquals(List.of(NullValue.INSTANCE), filter.getValues());
    }

    @Test
    void insert_columnsAreSorted() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("b", 2);
        values.put("a", "one");
        values.put("c", null);
        CompiledQuery q = compile(QueryAction.insert(values));
        assertEquals("INSERT INTO items (a, b, c) VALUES (?, ?, ?)", q.sql());
        assertEquals(List.of(new TextValue("one"), new IntegerValue(2), NullValue.INSTANCE), q.arguments());
    }

    @Test
    void insert_isDeterministicAcrossMapOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("x", 1);
        first.put("y", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("y", 2);
        second.put("x", 1);
        assertEquals(compile(QueryAction.insert(first)), compile(QueryAction.insert(second)));
    }

    @Test
    void insert_emptyUsesDefaults() {
        CompiledQuery q = compile(QueryAction.insert(Map.of()));
        assertEquals("INSERT INTO items DEFAULT VALUES", q.sql());
        assertEquals(List.of(), q.arguments());
    }

    @Test
    void insertMany_unionOfColumnsFillsNulls() {
        CompiledQuery q = compile(QueryAction.insertMany(List.of(
                Map.of("a", 1, "b", 2),
                Map.of("c", 3))));
        assertEquals("INSERT INTO items (a, b, c) VALUES (?, ?, ?), (?, ?, ?)", q.sql());
        assertEquals(List.of(
                new IntegerValue(1), new IntegerValue(2), NullValue.INSTANCE,
                NullValue.INSTANCE, NullValue.INSTANCE, new IntegerValue(3)), q.arguments());
    }

    @Test
    void insertMany_rejectsEmptyBatch() {
        assertThrows(IllegalArgumentException.class, () -> QueryAction.insertMany(List.of()));
    }

    @Test
    void update_setArgumentsPrecedeFilterArguments() {
        CompiledQuery q = compile(QueryAction.update(Map.of("title", "new", "done", true),
                List.of(QueryFilter.equalTo("id", "42"))));
        assertEquals("UPDATE items SET done = ?, title = ? WHERE id = ?", q.sql());
        assertEquals(List.of(new BooleanValue(true), new TextValue("new"), new TextValue("42")), q.arguments());
    }

    @Test
    void update_rejectsEmptyValues() {
        assertThrows(IllegalArgumentException.class, () -> QueryAction.update(Map.of(), List.of()));
    }

    @Test
    void delete_withAndWithoutFilters() {
        assertEquals("DELETE FROM items", compile(QueryAction.delete(List.of())).sql());
        CompiledQuery q = compile(QueryAction.delete(List.of(QueryFilter.lessThan("age", 3))));
        assertEquals("DELETE FROM items WHERE age < ?", q.sql());
        assertEquals(args(3), q.arguments());
    }

    @Test
    void deleteMany_keepsIdOrder() {
        CompiledQuery q = compile(QueryAction.deleteMany("id", List.of("c", "a", "b")));
        assertEquals("DELETE FROM items WHERE id IN (?, ?, ?)", q.sql());
        assertEquals(args("c", "a", "b"), q.arguments());
    }

    @Test
    void deleteMany_emptyDeletesNothing() {
        CompiledQuery q = compile(QueryAction.deleteMany("id", List.of()));
        assertEquals("DELETE FROM items WHERE 1=0", q.sql());
        assertEquals(List.of(), q.arguments());
    }

    @Test
    void upsert_updatesEveryNonConflictColumn() {
        CompiledQuery q = compile(QueryAction.upsert(Map.of("id", 1, "b", "x", "a", "y"), List.of("id")));
        assertEquals("INSERT INTO items (a, b, id) VALUES (?, ?, ?) ON CONFLICT(id) "
                + "DO UPDATE SET a = excluded.a, b = excluded.b", q.sql());
        assertEquals(args("y", "x", 1), q.arguments());
    }

    @Test
    void upsert_explicitUpdateColumns() {
        QueryAction.Upsert upsert = QueryAction.upsert(Map.of("id", 1, "a", 2, "b", 3), List.of("id"), List.of("b"));
        assertEquals(List.of("b"), upsert.updateColumns());
        assertEquals("INSERT INTO items (a, b, id) VALUES (?, ?, ?) ON CONFLICT(id) DO UPDATE SET b = excluded.b",
                compile(upsert).sql());
    }

    @Test
    void upsert_nothingToUpdateDoesNothing() {
        CompiledQuery q = compile(QueryAction.upsert(Map.of("id", 1), List.of("id")));
        assertEquals("INSERT INTO items (id) VALUES (?) ON CONFLICT(id) DO NOTHING", q.sql());
    }

    @Test
    void upsert_requiresValuesAndConflictColumns() {
        assertThrows(IllegalArgumentException.class, () -> QueryAction.upsert(Map.of(), List.of("id")));
        assertThrows(IllegalArgumentException.class, () -> QueryAction.upsert(Map.of("id", 1), List.of()));
    }

    @Test
    void query_requiresTable() {
        assertThrows(IllegalArgumentException.class, () -> new Query(" ", QueryAction.selectAll()));
    }
}
