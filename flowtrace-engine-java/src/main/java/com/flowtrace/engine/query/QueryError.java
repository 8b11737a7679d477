package com.flowtrace.engine.query;

import com.flowtrace.engine.graph.ErrorKind;

public record QueryError(ErrorKind kind, String message) {}
