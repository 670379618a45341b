package com.fusestorage.query;

public enum SortOrder {
    ASCENDING("ASC"),
    DESCENDING("DESC");

    private final String keyword;

    SortOrder(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }
}
