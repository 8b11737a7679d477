package com.flowtrace.engine.ast;

/**
 * Where a statement came from: its location, control context and the trimmed source line.
 */
public record Origin(Location location, ControlContext context, String code) {

    public int line() {
        return location.line();
    }
}
