package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.Location;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Directed graph of variable versions and dependency edges.
 *
 * Nodes live in an arena addressed by dense integer ids, so traversals can track visits in a
 * bitset. At most one edge is kept per (from, to) pair; the first kind recorded wins. The graph
 * may contain cycles once calls are linked.
 */
public final class FlowGraph {

    private final List<FlowNode> nodes = new ArrayList<>();
    private final List<FlowEdge> edges = new ArrayList<>();
    private final List<List<FlowEdge>> outgoing = new ArrayList<>();
    private final List<List<FlowEdge>> incoming = new ArrayList<>();
    private final Set<Long> edgeKeys = new HashSet<>();
    private final List<Scope> scopes = new ArrayList<>();
    private final List<CallSite> callSites = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<String> files = new ArrayList<>();

    /** Adds a node; the template's id is replaced by the next free one. */
    public int addNode(FlowNode template) {
        int id = nodes.size();
        nodes.add(template.withIds(id, template.scopeId()));
        outgoing.add(new ArrayList<>());
        incoming.add(new ArrayList<>());
        return id;
    }

    /** Returns false for self-loops and for a (from, to) pair that already has an edge. */
    public boolean addEdge(int from, int to, EdgeKind kind, Location location) {
        if (from == to) return false;
        long key = ((long) from << 32) | (to & 0xffffffffL);
        if (!edgeKeys.add(key)) return false;
        FlowEdge edge = new FlowEdge(from, to, kind, location);
        edges.add(edge);
        outgoing.get(from).add(edge);
        incoming.get(to).add(edge);
        return true;
    }

    public int addScope(Scope template) {
        int id = scopes.size();
        scopes.add(template.withId(id));
        return id;
    }

    public void updateScope(Scope scope) {
        scopes.set(scope.id(), scope);
    }

    public int addCallSite(CallSite template) {
        int id = callSites.size();
        callSites.add(template.withId(id));
        return id;
    }

    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addFile(String path) {
        files.add(path);
    }

    public FlowNode node(int id)            { return nodes.get(id); }
    public Scope scope(int id)              { return scopes.get(id); }
    public int nodeCount()                  { return nodes.size(); }
    public List<FlowNode> nodes()           { return Collections.unmodifiableList(nodes); }
    public List<FlowEdge> edges()           { return Collections.unmodifiableList(edges); }
    public List<FlowEdge> outgoing(int id)  { return Collections.unmodifiableList(outgoing.get(id)); }
    public List<FlowEdge> incoming(int id)  { return Collections.unmodifiableList(incoming.get(id)); }
    public List<Scope> scopes()             { return Collections.unmodifiableList(scopes); }
    public List<CallSite> callSites()       { return Collections.unmodifiableList(callSites); }
    public List<Diagnostic> diagnostics()   { return Collections.unmodifiableList(diagnostics); }
    public List<String> files()             { return Collections.unmodifiableList(files); }

    public boolean hasParseErrors() {
        return diagnostics.stream().anyMatch(d -> d.kind() == ErrorKind.PARSE_ERROR);
    }

    /**
     * Every version of a variable, in id (source) order. A bare attribute name also matches the
     * fields it names, so {@code total} finds {@code self.total}.
     */
    public List<Integer> versionsOf(String variable) {
        List<Integer> ids = new ArrayList<>();
        for (FlowNode n : nodes) {
            if (!n.kind().isVariable()) continue;
            if (n.name().equals(variable)
                    || (n.kind() == NodeKind.FIELD && n.name().endsWith("." + variable))) {
                ids.add(n.id());
            }
        }
        return ids;
    }

    /** Name of the function a node belongs to, or {@code <module>}. */
    public String functionOf(FlowNode node) {
        Scope s = scopes.get(node.scopeId());
        while (s.kind() == ScopeKind.CLASS && s.parentId() >= 0) {
            s = scopes.get(s.parentId());
        }
        return s.kind() == ScopeKind.FUNCTION ? s.name() : "<module>";
    }

    /**
     * Union of independently built graphs. Ids of the later parts are shifted past the earlier
     * ones; nothing else changes, so merging in the same order always gives the same graph.
     */
    public static FlowGraph merge(List<FlowGraph> parts) {
        FlowGraph merged = new FlowGraph();
        for (FlowGraph part : parts) {
            int nodeOffset = merged.nodes.size();
            int scopeOffset = merged.scopes.size();
            int callOffset = merged.callSites.size();
            for (FlowNode n : part.nodes) {
                merged.addNode(n.withIds(n.id() + nodeOffset, n.scopeId() + scopeOffset));
            }
            for (FlowEdge e : part.edges) {
                merged.addEdge(e.from() + nodeOffset, e.to() + nodeOffset, e.kind(), e.location());
            }
            for (Scope s : part.scopes) {
                merged.scopes.add(s.shifted(scopeOffset, nodeOffset));
            }
            for (CallSite c : part.callSites) {
                merged.callSites.add(c.shifted(callOffset, scopeOffset, nodeOffset));
            }
            merged.diagnostics.addAll(part.diagnostics);
            merged.files.addAll(part.files);
        }
        return merged;
    }
}
