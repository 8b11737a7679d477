package com.flowtrace.engine.ast;

/**
 * A source position: file path as given to the adapter, and 1-based line.
 */
public record Location(String file, int line) {

    @Override
    public String toString() {
        return file + ":" + line;
    }
}
