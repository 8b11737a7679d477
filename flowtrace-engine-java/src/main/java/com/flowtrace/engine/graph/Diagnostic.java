package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.Location;

/**
 * A non-fatal problem found while building or linking a graph. {@code location} may be null.
 */
public record Diagnostic(ErrorKind kind, String message, Location location) {

    @Override
    public String toString() {
        return (location != null ? location + ": " : "") + kind.id() + ": " + message;
    }
}
