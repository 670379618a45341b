package com.fusestorage.query;

import com.fusestorage.value.StorageValue;

import java.util.Collections;
import java.util.List;

final class Sql {
    private Sql() {
    }

    static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }

    static String where(List<QueryFilter> filters, List<StorageValue> arguments) {
        if (filters.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(" WHERE ");
        for (int i = 0; i < filters.size(); i++) {
            if (i > 0) {
                sb.append(" AND ");
            }
            sb.append(filters.get(i).compile(arguments));
        }
        return sb.toString();
    }
}
