package com.flowtrace.engine.query;

/**
 * What a query computes on top of the traversal.
 */
public enum AnalysisMode {
    /** Plain forward and/or backward reachability. */
    FLOW("flow"),
    /** Forward reachability plus exit-point classification and risk. */
    IMPACT("impact"),
    /** Backward reachability plus the ordered calculation steps. */
    CALC_PATH("calc-path"),
    /** Type and state history of every version. */
    STATE("state"),
    /** Every variable with its direct dependencies and dependents. */
    SHOW_ALL("show-all");

    private final String id;

    AnalysisMode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static AnalysisMode parse(String text) {
        for (AnalysisMode m : values()) {
            if (m.id.equalsIgnoreCase(text)) return m;
        }
        throw new IllegalArgumentException("Unknown mode: " + text
            + " (expected flow, impact, calc-path, state or show-all)");
    }
}
