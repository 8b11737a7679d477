package com.flowtrace.engine.analysis;

import com.flowtrace.engine.graph.FlowEdge;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.traverse.Reachability;
import com.flowtrace.engine.traverse.Traversal;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeSet;

/**
 * Orders the backward-reachable subgraph of a node into the steps that produced its value.
 *
 * Kahn's algorithm over the subgraph; among ready nodes the earliest in source order (file,
 * line, id) goes first. When only cycle members remain, the earliest of them is released anyway.
 * Each node appears once and the walk stops at the target.
 */
public class CalculationPathExtractor {

    public List<CalculationStep> extract(FlowGraph graph, int target) {
        Reachability back = Traversal.backward(graph, List.of(target), -1);
        BitSet members = new BitSet(graph.nodeCount());
        members.set(target);
        for (int n : back.reached()) members.set(n);

        Comparator<Integer> sourceOrder = Comparator
            .comparing((Integer id) -> graph.node(id).location().file())
            .thenComparingInt(id -> graph.node(id).line())
            .thenComparingInt(id -> id);

        Map<Integer, Integer> pending = new HashMap<>();
        PriorityQueue<Integer> ready = new PriorityQueue<>(sourceOrder);
        TreeSet<Integer> waiting = new TreeSet<>(sourceOrder);
        for (int n = members.nextSetBit(0); n >= 0; n = members.nextSetBit(n + 1)) {
            int inDegree = 0;
            for (FlowEdge e : graph.incoming(n)) {
                if (members.get(e.from())) inDegree++;
            }
            pending.put(n, inDegree);
            if (inDegree == 0) ready.add(n);
            else waiting.add(n);
        }

        List<CalculationStep> steps = new ArrayList<>();
        BitSet emitted = new BitSet(graph.nodeCount());
        while (!emitted.get(target)) {
            if (ready.isEmpty()) {
                ready.add(waiting.pollFirst());
            }
            int n = ready.poll();
            waiting.remove(n);
            if (emitted.get(n)) continue;
            emitted.set(n);
            steps.add(step(graph, n, members));
            for (FlowEdge e : graph.outgoing(n)) {
                if (!members.get(e.to()) || emitted.get(e.to())) continue;
                int left = pending.merge(e.to(), -1, Integer::sum);
                if (left == 0) {
                    waiting.remove(e.to());
                    ready.add(e.to());
                }
            }
        }
        return steps;
    }

    private static CalculationStep step(FlowGraph graph, int id, BitSet members) {
        FlowNode node = graph.node(id);
        List<String> inputs = new ArrayList<>();
        for (FlowEdge e : graph.incoming(id)) {
            if (!members.get(e.from())) continue;
            FlowNode in = graph.node(e.from());
            inputs.add(in.name() + "@" + in.line());
        }
        return new CalculationStep(id, node.name(), node.kind(), node.location(), node.code(), node.expression(),
            inputs);
    }
}
