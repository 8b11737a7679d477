package com.flowtrace.engine.render;

import com.flowtrace.engine.graph.FlowEdge;
import com.flowtrace.engine.query.FlowResult;
import com.flowtrace.engine.query.QueryResponse;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Graphviz export of the traced subgraph: the queried variable's versions (highlighted), every
 * reached node, and the edges between them. Nodes of several results are drawn once.
 */
public class DotRenderer {

    public String render(QueryResponse response) {
        Map<Integer, String> nodes = new LinkedHashMap<>();
        Set<Integer> origins = new LinkedHashSet<>();
        Set<String> edges = new LinkedHashSet<>();
        for (FlowResult r : response.results()) {
            for (FlowResult.Entry e : r.origins()) {
                nodes.putIfAbsent(e.nodeId(), label(e));
                origins.add(e.nodeId());
            }
            for (FlowResult.Entry e : r.entries()) nodes.putIfAbsent(e.nodeId(), label(e));
            for (FlowEdge e : r.edges()) {
                edges.add("  n" + e.from() + " -> n" + e.to() + " [label=\"" + e.kind().id() + "\"];");
            }
        }

        StringBuilder out = new StringBuilder("digraph dataflow {\n  rankdir=LR;\n  node [shape=box];\n");
        for (Map.Entry<Integer, String> n : nodes.entrySet()) {
            out.append("  n").append(n.getKey()).append(" [label=\"").append(n.getValue()).append('"');
            if (origins.contains(n.getKey())) out.append(", style=filled, fillcolor=lightblue");
            out.append("];\n");
        }
        for (String e : edges) out.append(e).append('\n');
        return out.append("}\n").toString();
    }

    private static String label(FlowResult.Entry e) {
        return escape(e.name()) + "\\n" + escape(e.location().toString());
    }

    static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
