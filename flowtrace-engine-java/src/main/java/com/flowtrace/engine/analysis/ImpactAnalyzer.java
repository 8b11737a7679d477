package com.flowtrace.engine.analysis;

import com.flowtrace.engine.config.EngineConfig;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.traverse.Reachability;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies where a variable's value ends up and scores the risk of changing it.
 *
 * Every forward-reachable return slot, side-effect sink and field or global write is an exit
 * point. Risk thresholds come from {@link EngineConfig}:
 * <ul>
 *   <li>HIGH: more distinct functions touched than {@code risk_high_function_count}, or at least
 *       {@code risk_high_exit_points} exit points</li>
 *   <li>MEDIUM: any side effect, or at least {@code risk_medium_exit_points} exit points</li>
 *   <li>LOW: everything else</li>
 * </ul>
 */
public class ImpactAnalyzer {

    static final String NOTE = "Heuristic analysis: side effects are recognized by call name only; "
        + "aliased, indirect and dynamically dispatched calls are not detected.";

    private final EngineConfig config;

    public ImpactAnalyzer(EngineConfig config) {
        this.config = config;
    }

    public ImpactReport analyze(FlowGraph graph, String variable, Reachability forward) {
        List<ExitPoint> exits = new ArrayList<>();
        Map<ExitCategory, Integer> counts = new EnumMap<>(ExitCategory.class);
        for (ExitCategory c : ExitCategory.values()) counts.put(c, 0);

        Set<String> functions = new LinkedHashSet<>();
        for (int id : forward.starts()) touch(graph, graph.node(id), functions);
        for (int id : forward.reached()) {
            FlowNode node = graph.node(id);
            touch(graph, node, functions);
            ExitPoint exit = classify(graph, node);
            if (exit != null) {
                exits.add(exit);
                counts.merge(exit.category(), 1, Integer::sum);
            }
        }

        RiskLevel risk = risk(exits.size(), functions.size(), counts.get(ExitCategory.SIDE_EFFECT) > 0);
        return new ImpactReport(variable, exits, counts, functions.size(), risk,
            recommendation(risk, counts), true, NOTE);
    }

    private static void touch(FlowGraph graph, FlowNode node, Set<String> functions) {
        String function = graph.functionOf(node);
        if (!function.equals("<module>")) functions.add(function);
    }

    private static ExitPoint classify(FlowGraph graph, FlowNode node) {
        String function = graph.functionOf(node);
        switch (node.kind()) {
            case RETURN:
                return new ExitPoint(ExitCategory.RETURN, "return", function, node.location(),
                    "returned from " + function, node.id());
            case SINK:
                return new ExitPoint(ExitCategory.SIDE_EFFECT, node.category(), function, node.location(),
                    node.category() + " call " + node.name(), node.id());
            case FIELD:
                return new ExitPoint(ExitCategory.STATE_CHANGE, "field", function, node.location(),
                    "modifies field " + node.name(), node.id());
            case GLOBAL:
                return new ExitPoint(ExitCategory.STATE_CHANGE, "global", function, node.location(),
                    "modifies global " + node.name(), node.id());
            default:
                return null;
        }
    }

    RiskLevel risk(int exitPoints, int functionsTouched, boolean sideEffects) {
        if (functionsTouched > config.getRiskHighFunctionCount() || exitPoints >= config.getRiskHighExitPoints()) {
            return RiskLevel.HIGH;
        }
        if (sideEffects || exitPoints >= config.getRiskMediumExitPoints()) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static String recommendation(RiskLevel risk, Map<ExitCategory, Integer> counts) {
        switch (risk) {
            case HIGH:
                return "Comprehensive testing required - consider breaking into smaller changes";
            case MEDIUM:
                return counts.get(ExitCategory.SIDE_EFFECT) > 0
                    ? "External side effects detected - ensure testing covers these"
                    : "Several exit points - test each affected path";
            default:
                return counts.get(ExitCategory.STATE_CHANGE) > 0
                    ? "Only internal state changes - standard testing sufficient"
                    : "Local scope only - safe to modify";
        }
    }
}
