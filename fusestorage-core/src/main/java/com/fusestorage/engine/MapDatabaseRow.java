package com.fusestorage.engine;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DatabaseRow} backed by an insertion-ordered map.
 */
@ToString
@EqualsAndHashCode
public final class MapDatabaseRow implements DatabaseRow {
    private final Map<String, Object> values;

    public MapDatabaseRow(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @Override
    public Object get(String column) {
        return values.get(column);
    }

    @Override
    public List<String> getColumnNames() {
        return new ArrayList<>(values.keySet());
    }

    @Override
    public boolean hasColumn(String column) {
        return values.containsKey(column);
    }

    public Map<String, Object> asMap() {
        return values;
    }
}
