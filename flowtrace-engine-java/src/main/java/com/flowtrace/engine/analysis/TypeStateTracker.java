package com.flowtrace.engine.analysis;

import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.graph.InferredType;
import com.flowtrace.engine.graph.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Follows the inferred type of a variable across its versions. An {@code Unknown} version is
 * skipped when comparing types, so it never produces a type-change warning.
 */
public class TypeStateTracker {

    public List<StateReport> track(FlowGraph graph, String variable) {
        Map<Integer, List<FlowNode>> byScope = new LinkedHashMap<>();
        for (int id : graph.versionsOf(variable)) {
            FlowNode node = graph.node(id);
            byScope.computeIfAbsent(node.scopeId(), k -> new ArrayList<>()).add(node);
        }
        List<StateReport> reports = new ArrayList<>();
        for (Map.Entry<Integer, List<FlowNode>> e : byScope.entrySet()) {
            reports.add(report(variable, graph.scope(e.getKey()).name(), e.getValue()));
        }
        return reports;
    }

    private StateReport report(String variable, String scope, List<FlowNode> versions) {
        List<TypeEvent> events = new ArrayList<>();
        for (FlowNode n : versions) {
            events.add(new TypeEvent(n.id(), eventOf(n), n.type(), n.location(), n.expression(), n.context()));
        }

        List<String> chain = new ArrayList<>();
        List<StateWarning> warnings = new ArrayList<>();
        InferredType previous = null;
        for (TypeEvent ev : events) {
            if (!ev.type().isKnown()) continue;
            if (previous != null && !previous.display().equals(ev.type().display())) {
                warnings.add(new StateWarning(StateWarning.Kind.TYPE_CHANGE,
                    variable + " changes type from " + previous.display() + " to " + ev.type().display(),
                    ev.location(), ev.nodeId()));
            }
            if (chain.isEmpty() || !chain.get(chain.size() - 1).equals(ev.type().display())) {
                chain.add(ev.type().display());
            }
            previous = ev.type();
        }

        boolean someNonNull = events.stream().anyMatch(ev -> !ev.nullable());
        for (TypeEvent ev : events) {
            if (ev.nullable() && someNonNull) {
                warnings.add(new StateWarning(StateWarning.Kind.POSSIBLE_NULL,
                    variable + " may be " + nullWord(ev) + " here", ev.location(), ev.nodeId()));
            }
            if (ev.event().equals("parameter")) continue;
            if (ev.context().inLoop()) {
                warnings.add(new StateWarning(StateWarning.Kind.MODIFIED_IN_LOOP,
                    variable + " is modified inside a loop", ev.location(), ev.nodeId()));
            }
            if (ev.context().inConditional()) {
                warnings.add(new StateWarning(StateWarning.Kind.MODIFIED_IN_CONDITIONAL,
                    variable + " is modified inside a conditional branch", ev.location(), ev.nodeId()));
            }
        }
        return new StateReport(variable, scope, events, chain, warnings);
    }

    private static String eventOf(FlowNode n) {
        if (n.kind() == NodeKind.PARAMETER) return "parameter";
        if (n.mutation()) return "mutation";
        if (n.expression() == null || n.expression().isEmpty()) return "declaration";
        return "assignment";
    }

    private static String nullWord(TypeEvent ev) {
        return ev.location().file().endsWith(".py") ? "None" : "null";
    }
}
