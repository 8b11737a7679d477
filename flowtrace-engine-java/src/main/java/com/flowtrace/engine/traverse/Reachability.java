package com.flowtrace.engine.traverse;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one breadth-first traversal: the reached nodes in discovery order, the hop count at
 * which each was found, and a BFS parent pointer giving one shortest path back to a start node.
 */
public final class Reachability {

    private final boolean forward;
    private final List<Integer> starts;
    private final List<Integer> reached;
    private final Map<Integer, Integer> depth;
    private final Map<Integer, Integer> parent;
    private final boolean truncated;

    Reachability(boolean forward, List<Integer> starts, List<Integer> reached, Map<Integer, Integer> depth,
                 Map<Integer, Integer> parent, boolean truncated) {
        this.forward = forward;
        this.starts = List.copyOf(starts);
        this.reached = Collections.unmodifiableList(reached);
        this.depth = depth;
        this.parent = parent;
        this.truncated = truncated;
    }

    public boolean forward()        { return forward; }
    public List<Integer> starts()   { return starts; }

    /** Reached nodes, start nodes excluded, in first-discovery order. */
    public List<Integer> reached()  { return reached; }

    /** True when the depth limit stopped the search before it ran out of edges. */
    public boolean truncated()      { return truncated; }

    public boolean contains(int node) {
        return depth.containsKey(node) && !starts.contains(node);
    }

    /** Hops from the nearest start node; 1 for a direct neighbor. */
    public int depthOf(int node) {
        Integer d = depth.get(node);
        if (d == null) throw new IllegalArgumentException("node " + node + " was not reached");
        return d;
    }

    /** Shortest discovered path from a start node to {@code node}, in traversal order. */
    public List<Integer> pathTo(int node) {
        if (!depth.containsKey(node)) throw new IllegalArgumentException("node " + node + " was not reached");
        List<Integer> path = new ArrayList<>();
        for (Integer n = node; n != null; n = parent.get(n)) path.add(n);
        Collections.reverse(path);
        return path;
    }

    /**
     * One path per leaf of the BFS tree, oriented in data-flow direction: source first. For a
     * backward traversal that means the leaf comes first and the start node last.
     */
    public List<List<Integer>> flowPaths() {
        BitSet inner = new BitSet();
        for (int n : reached) {
            Integer p = parent.get(n);
            if (p != null) inner.set(p);
        }
        List<List<Integer>> paths = new ArrayList<>();
        for (int n : reached) {
            if (inner.get(n)) continue;
            List<Integer> path = pathTo(n);
            if (!forward) Collections.reverse(path);
            paths.add(path);
        }
        return paths;
    }
}
