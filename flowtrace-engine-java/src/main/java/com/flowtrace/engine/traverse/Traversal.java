package com.flowtrace.engine.traverse;

import com.flowtrace.engine.graph.FlowEdge;
import com.flowtrace.engine.graph.FlowGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Breadth-first reachability over a {@link FlowGraph}. Visits are tracked in a bitset over the
 * dense node ids, so every node is expanded at most once and cyclic graphs terminate.
 */
public final class Traversal {

    private Traversal() {}

    /** Everything the start nodes flow into. */
    public static Reachability forward(FlowGraph graph, List<Integer> starts, int maxDepth) {
        return run(graph, starts, maxDepth, true);
    }

    /** Everything the start nodes are computed from. */
    public static Reachability backward(FlowGraph graph, List<Integer> starts, int maxDepth) {
        return run(graph, starts, maxDepth, false);
    }

    /**
     * @param maxDepth -1 for no limit; otherwise nodes up to {@code maxDepth} hops away are
     *                 expanded, so 0 yields only direct neighbors
     */
    private static Reachability run(FlowGraph graph, List<Integer> starts, int maxDepth, boolean forward) {
        BitSet seen = new BitSet(graph.nodeCount());
        Map<Integer, Integer> depth = new HashMap<>();
        Map<Integer, Integer> parent = new HashMap<>();
        List<Integer> reached = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        boolean truncated = false;

        for (int s : starts) {
            if (seen.get(s)) continue;
            seen.set(s);
            depth.put(s, 0);
            queue.add(s);
        }
        while (!queue.isEmpty()) {
            int node = queue.poll();
            int d = depth.get(node);
            List<FlowEdge> edges = forward ? graph.outgoing(node) : graph.incoming(node);
            if (maxDepth >= 0 && d > maxDepth) {
                for (FlowEdge e : edges) {
                    if (!seen.get(forward ? e.to() : e.from())) {
                        truncated = true;
                        break;
                    }
                }
                continue;
            }
            for (FlowEdge e : edges) {
                int next = forward ? e.to() : e.from();
                if (seen.get(next)) continue;
                seen.set(next);
                depth.put(next, d + 1);
                parent.put(next, node);
                reached.add(next);
                queue.add(next);
            }
        }
        return new Reachability(forward, starts, reached, depth, parent, truncated);
    }
}
