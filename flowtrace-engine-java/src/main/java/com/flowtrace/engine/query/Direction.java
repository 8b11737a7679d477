package com.flowtrace.engine.query;

public enum Direction {
    FORWARD, BACKWARD, BOTH;

    public String id() {
        return name().toLowerCase();
    }

    public static Direction parse(String text) {
        for (Direction d : values()) {
            if (d.id().equalsIgnoreCase(text)) return d;
        }
        throw new IllegalArgumentException("Unknown direction: " + text + " (expected forward, backward or both)");
    }
}
