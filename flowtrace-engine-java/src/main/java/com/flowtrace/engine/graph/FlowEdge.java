package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.Location;

/** Value flows from node {@code from} into node {@code to}. */
public record FlowEdge(int from, int to, EdgeKind kind, Location location) {}
