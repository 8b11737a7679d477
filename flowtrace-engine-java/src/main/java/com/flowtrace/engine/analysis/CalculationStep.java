package com.flowtrace.engine.analysis;

import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.graph.NodeKind;

import java.util.List;

/**
 * One node of a calculation path.
 *
 * @param inputs display names of the nodes this one is computed from, as {@code name@line}
 */
public record CalculationStep(int nodeId, String name, NodeKind kind, Location location, String code,
                              String expression, List<String> inputs) {}
