package com.flowtrace.engine.ast;

/**
 * A syntax failure reported by a front end. The file it belongs to is skipped.
 */
public record ParseError(String file, int line, int column, String message) {

    @Override
    public String toString() {
        return file + ":" + line + ":" + column + ": " + message;
    }
}
