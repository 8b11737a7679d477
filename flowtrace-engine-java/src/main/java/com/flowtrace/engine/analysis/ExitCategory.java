package com.flowtrace.engine.analysis;

public enum ExitCategory {
    RETURN("Return"),
    SIDE_EFFECT("SideEffect"),
    STATE_CHANGE("StateChange");

    private final String id;

    ExitCategory(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
