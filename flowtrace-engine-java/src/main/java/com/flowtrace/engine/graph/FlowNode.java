package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Location;

/**
 * One version of a variable, or a synthetic node. Ids are dense indexes into the owning graph.
 *
 * @param expression source summary of the value written at this version
 * @param mutation   true when the version was produced by an in-place change of the previous one
 * @param category   side-effect category, for {@link NodeKind#SINK} nodes only
 */
public record FlowNode(
    int id,
    String name,
    NodeKind kind,
    int scopeId,
    Location location,
    String code,
    String expression,
    InferredType type,
    ControlContext context,
    boolean mutation,
    String category
) {

    public FlowNode withIds(int newId, int newScopeId) {
        return new FlowNode(newId, name, kind, newScopeId, location, code, expression, type, context, mutation, category);
    }

    public int line() {
        return location.line();
    }
}
