package com.flowtrace.engine.render;

public enum OutputFormat {
    TEXT, JSON, GRAPH;

    public static OutputFormat parse(String text) {
        for (OutputFormat f : values()) {
            if (f.name().equalsIgnoreCase(text)) return f;
        }
        throw new IllegalArgumentException("Unknown format: " + text + " (expected text, json or graph)");
    }
}
