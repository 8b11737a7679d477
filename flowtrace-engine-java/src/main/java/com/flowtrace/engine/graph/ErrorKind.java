package com.flowtrace.engine.graph;

/**
 * Kinds of problems reported at the engine boundary. The first five are per-file diagnostics;
 * the rest fail a single query or the whole request.
 */
public enum ErrorKind {
    PARSE_ERROR("parse_error"),
    UNRESOLVED_REFERENCE("unresolved_reference"),
    UNSUPPORTED_CONSTRUCT("unsupported_construct"),
    DEPTH_LIMIT_REACHED("depth_limit_reached"),
    RECURSION_HALTED("recursion_halted"),
    VARIABLE_NOT_FOUND("variable_not_found"),
    TIMEOUT("timeout"),
    INVALID_QUERY("invalid_query");

    private final String id;

    ErrorKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
