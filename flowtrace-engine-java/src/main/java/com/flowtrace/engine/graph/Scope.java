package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.Location;

import java.util.List;

/**
 * A module, class or function.
 *
 * @param name         qualified name, e.g. {@code Calculator.total}
 * @param simpleName   last segment, used for call resolution
 * @param parentId     enclosing scope, -1 for a module
 * @param className    nearest enclosing class (the class itself for a class scope), or null
 * @param returnNodeId the function's return slot, -1 until a value is returned
 */
public record Scope(
    int id,
    String name,
    String simpleName,
    ScopeKind kind,
    int parentId,
    String file,
    String className,
    List<String> paramNames,
    List<Integer> paramNodeIds,
    int returnNodeId,
    Location location
) {

    public Scope withId(int newId) {
        return new Scope(newId, name, simpleName, kind, parentId, file, className, paramNames, paramNodeIds,
            returnNodeId, location);
    }

    public Scope withParams(List<Integer> newParamNodeIds) {
        return new Scope(id, name, simpleName, kind, parentId, file, className, paramNames,
            List.copyOf(newParamNodeIds), returnNodeId, location);
    }

    public Scope withReturnNode(int newReturnNodeId) {
        return new Scope(id, name, simpleName, kind, parentId, file, className, paramNames, paramNodeIds,
            newReturnNodeId, location);
    }

    /** Shifts every id by the given offsets when graphs are merged. */
    Scope shifted(int scopeOffset, int nodeOffset) {
        return new Scope(id + scopeOffset, name, simpleName, kind, parentId < 0 ? -1 : parentId + scopeOffset, file,
            className, paramNames, paramNodeIds.stream().map(n -> n + nodeOffset).toList(),
            returnNodeId < 0 ? -1 : returnNodeId + nodeOffset, location);
    }

    public boolean isFunction() {
        return kind == ScopeKind.FUNCTION;
    }
}
