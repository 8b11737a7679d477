package com.flowtrace.engine.graph;

/**
 * What a graph node stands for. The first four are variables a user can ask about; the rest are
 * synthetic nodes the builder and linker create.
 */
public enum NodeKind {
    LOCAL("local"),
    PARAMETER("parameter"),
    FIELD("field"),
    GLOBAL("global"),
    /** A function's return slot, {@code f.return}. */
    RETURN("return"),
    /** Sentinel leaf for a name with no visible definition (imports, builtins). */
    EXTERNAL("external"),
    /** Argument sink of a side-effect call such as {@code print(...)}. */
    SINK("sink"),
    /** Value of a call nested inside a larger expression, {@code f()}. */
    CALL_RESULT("call_result"),
    /** A literal argument bound to a resolved parameter. */
    LITERAL("literal"),
    /** Marks where inter-procedural expansion stopped at the depth limit. */
    TRUNCATED("truncated");

    private final String id;

    NodeKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public boolean isVariable() {
        return this == LOCAL || this == PARAMETER || this == FIELD || this == GLOBAL;
    }
}
