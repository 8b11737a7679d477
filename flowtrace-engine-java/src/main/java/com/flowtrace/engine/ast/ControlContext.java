package com.flowtrace.engine.ast;

/**
 * Loop and conditional nesting of a statement inside its enclosing function (or module).
 * A function body starts again at {@link #TOP}.
 */
public record ControlContext(int loopDepth, int conditionalDepth) {

    public static final ControlContext TOP = new ControlContext(0, 0);

    public ControlContext enterLoop() {
        return new ControlContext(loopDepth + 1, conditionalDepth);
    }

    public ControlContext enterConditional() {
        return new ControlContext(loopDepth, conditionalDepth + 1);
    }

    public boolean inLoop()        { return loopDepth > 0; }
    public boolean inConditional() { return conditionalDepth > 0; }
}
