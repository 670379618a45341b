package com.fusestorage.query;

import java.util.Objects;

public record SortField(String field, SortOrder order) {
    public SortField {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(order, "order");
    }

    String compile() {
        return field + " " + order.keyword();
    }
}
