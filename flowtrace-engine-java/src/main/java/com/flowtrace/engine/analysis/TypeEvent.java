package com.flowtrace.engine.analysis;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.graph.InferredType;

/**
 * The type of one version of a variable.
 *
 * @param event {@code parameter}, {@code declaration}, {@code assignment} or {@code mutation}
 */
public record TypeEvent(int nodeId, String event, InferredType type, Location location, String expression,
                        ControlContext context) {

    public boolean nullable() {
        return type.nullable();
    }
}
