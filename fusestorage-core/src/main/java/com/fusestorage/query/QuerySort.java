package com.fusestorage.query;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered list of sort keys; earlier keys take precedence.
 */
public final class QuerySort {
    private final List<SortField> fields;

    public QuerySort(List<SortField> fields) {
        this.fields = List.copyOf(fields);
    }

    public static QuerySort by(String field, SortOrder order) {
        return new QuerySort(List.of(new SortField(field, order)));
    }

    public static QuerySort ascending(String field) {
        return by(field, SortOrder.ASCENDING);
    }

    public static QuerySort descending(String field) {
        return by(field, SortOrder.DESCENDING);
    }

    /**
     * Append a tie-break key.
     *
     * @param field column name
     * @param order direction
     * @return new sort with the key appended
     */
    public QuerySort then(String field, SortOrder order) {
        List<SortField> next = new ArrayList<>(fields);
        next.add(new SortField(field, order));
        return new QuerySort(next);
    }

    public List<SortField> getFields() {
        return fields;
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    String compile() {
        return "ORDER BY " + fields.stream().map(SortField::compile).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return isEmpty() ? "" : compile();
    }
}
