package com.fusestorage.engine;

@FunctionalInterface
public interface TableBuilderBody {
    void build(TableBuilder table);
}
