package com.flowtrace.engine.analysis;

public enum RiskLevel {
    LOW, MEDIUM, HIGH;

    public String id() {
        return name().toLowerCase();
    }
}
