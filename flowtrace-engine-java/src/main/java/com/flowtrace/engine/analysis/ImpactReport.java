package com.flowtrace.engine.analysis;

import java.util.List;
import java.util.Map;

/**
 * Result of an impact analysis. The classification is name-based and never sound: calls reached
 * through aliases or wrappers are missed, so {@code heuristic} is always true.
 */
public record ImpactReport(
    String variable,
    List<ExitPoint> exitPoints,
    Map<ExitCategory, Integer> counts,
    int functionsTouched,
    RiskLevel risk,
    String recommendation,
    boolean heuristic,
    String note
) {

    public int count(ExitCategory category) {
        return counts.getOrDefault(category, 0);
    }
}
