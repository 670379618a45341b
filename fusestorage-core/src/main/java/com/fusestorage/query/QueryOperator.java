package com.fusestorage.query;

public enum QueryOperator {
    EQUALS("="),
    NOT_EQUALS("!="),
    LIKE("LIKE"),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    IN_SET("IN");

    private final String symbol;

    QueryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
