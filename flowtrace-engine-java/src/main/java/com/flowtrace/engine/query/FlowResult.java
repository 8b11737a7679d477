package com.flowtrace.engine.query;

import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.graph.ErrorKind;
import com.flowtrace.engine.graph.FlowEdge;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.graph.NodeKind;
import com.flowtrace.engine.traverse.Reachability;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Traversal result for one direction. For a forward result the entries are what the variable
 * affects; for a backward one, what it depends on. {@code error} is set only when the variable
 * does not exist; an existing variable without dependencies gives empty entries and no error.
 */
public record FlowResult(
    String variable,
    Direction direction,
    List<Entry> origins,
    List<Entry> entries,
    List<String> flowPaths,
    List<List<Integer>> pathNodes,
    List<FlowEdge> edges,
    int totalCount,
    List<Integer> affectedLines,
    boolean truncated,
    QueryError error
) {

    /** A reached node. {@code depth} is its hop count from the nearest version of the variable. */
    public record Entry(int nodeId, String name, NodeKind kind, Location location, String code, String expression,
                        String function, int depth) {}

    public boolean found() {
        return error == null;
    }

    public static FlowResult notFound(String variable, Direction direction) {
        return new FlowResult(variable, direction, List.of(), List.of(), List.of(), List.of(), List.of(), 0, List.of(),
            false, new QueryError(ErrorKind.VARIABLE_NOT_FOUND, "Variable '" + variable + "' not found"));
    }

    public static FlowResult of(FlowGraph graph, String variable, Direction direction, Reachability reach) {
        List<Entry> origins = new ArrayList<>();
        for (int id : reach.starts()) origins.add(entry(graph, id, 0));
        List<Entry> entries = new ArrayList<>();
        for (int id : reach.reached()) entries.add(entry(graph, id, reach.depthOf(id)));

        List<List<Integer>> pathNodes = reach.flowPaths();
        List<String> flowPaths = new ArrayList<>();
        for (List<Integer> path : pathNodes) {
            flowPaths.add(path.stream().map(id -> graph.node(id).name()).collect(Collectors.joining(" → ")));
        }

        BitSet members = new BitSet(graph.nodeCount());
        for (int id : reach.starts()) members.set(id);
        for (int id : reach.reached()) members.set(id);
        List<FlowEdge> edges = new ArrayList<>();
        for (FlowEdge e : graph.edges()) {
            if (members.get(e.from()) && members.get(e.to())) edges.add(e);
        }

        TreeSet<Integer> lines = new TreeSet<>();
        for (Entry e : entries) lines.add(e.location().line());

        return new FlowResult(variable, direction, origins, entries, flowPaths, pathNodes, edges, entries.size(),
            new ArrayList<>(lines), reach.truncated(), null);
    }

    private static Entry entry(FlowGraph graph, int id, int depth) {
        FlowNode n = graph.node(id);
        return new Entry(id, n.name(), n.kind(), n.location(), n.code(), n.expression(), graph.functionOf(n), depth);
    }
}
