package com.flowtrace.engine.graph;

public enum EdgeKind {
    ASSIGNMENT("assignment"),
    AUGMENTED("augmented"),
    PARAMETER_BINDING("parameter_binding"),
    RETURN_BINDING("return_binding"),
    ATTRIBUTE_WRITE("attribute_write"),
    CALL_ARGUMENT("call_argument");

    private final String id;

    EdgeKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
