package com.flowtrace.engine.link;

import com.flowtrace.engine.graph.CallSite;
import com.flowtrace.engine.graph.Diagnostic;
import com.flowtrace.engine.graph.EdgeKind;
import com.flowtrace.engine.graph.ErrorKind;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.graph.InferredType;
import com.flowtrace.engine.graph.NodeKind;
import com.flowtrace.engine.graph.Scope;
import com.flowtrace.engine.graph.ScopeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds the edges of every call site in a merged graph.
 *
 * With inter-procedural linking off, or for a callee that cannot be resolved, each site gets the
 * conservative fallback: every argument flows straight into the call's result. Resolved callees
 * get parameter bindings and a return binding instead. Expansion walks outward from the entry
 * scopes (modules and functions no call reaches) with an explicit work-list; a callee already on
 * the current call chain stops expansion, and a chain longer than the call-depth limit ends in a
 * truncation marker.
 */
public class CallGraphLinker {

    /** A scope being expanded, with the call chain that reached it. */
    private record Frame(int scopeId, int depth, List<Long> chain) {}

    private FlowGraph graph;
    private Map<String, List<Scope>> scopesByName;
    private int[] resolved;
    private BitSet handled;

    /**
     * @param maxCallDepth how many nested calls to bind from an entry scope, -1 for no limit
     */
    public void link(FlowGraph graph, boolean interProcedural, int maxCallDepth) {
        this.graph = graph;
        List<CallSite> sites = graph.callSites();
        handled = new BitSet(sites.size());
        if (!interProcedural) {
            for (CallSite site : sites) fallback(site);
            return;
        }

        scopesByName = new HashMap<>();
        for (Scope s : graph.scopes()) {
            scopesByName.computeIfAbsent(s.simpleName(), k -> new ArrayList<>()).add(s);
        }
        resolved = new int[sites.size()];
        Map<Integer, List<CallSite>> sitesByCaller = new HashMap<>();
        Set<Integer> called = new HashSet<>();
        int linked = 0;
        for (CallSite site : sites) {
            resolved[site.id()] = resolve(site);
            sitesByCaller.computeIfAbsent(site.callerScopeId(), k -> new ArrayList<>()).add(site);
            if (resolved[site.id()] >= 0) {
                linked++;
                if (resolved[site.id()] != site.callerScopeId()) called.add(resolved[site.id()]);
            }
        }

        BitSet reached = new BitSet(graph.scopes().size());
        Deque<Frame> work = new ArrayDeque<>();
        for (Scope s : graph.scopes()) {
            if (!called.contains(s.id())) {
                reached.set(s.id());
                work.add(rootFrame(s.id()));
            }
        }
        while (true) {
            drain(work, sitesByCaller, reached, maxCallDepth);
            // Scopes only reachable from inside a call cycle.
            int next = reached.nextClearBit(0);
            if (next >= graph.scopes().size()) break;
            reached.set(next);
            work.add(rootFrame(next));
        }
        for (CallSite site : sites) {
            if (!handled.get(site.id())) fallback(site);
        }
        System.err.println("[flowtrace] Linked " + linked + " of " + sites.size() + " call sites");
    }

    private void drain(Deque<Frame> work, Map<Integer, List<CallSite>> sitesByCaller, BitSet reached, int maxCallDepth) {
        while (!work.isEmpty()) {
            Frame frame = work.poll();
            for (CallSite site : sitesByCaller.getOrDefault(frame.scopeId(), List.of())) {
                int callee = resolved[site.id()];
                if (callee < 0 || handled.get(site.id())) continue;
                long key = ((long) callee << 32) | site.id();

                if (callee == frame.scopeId() || onChain(frame.chain(), callee)) {
                    bind(site, graph.scope(callee));
                    handled.set(site.id());
                    graph.addDiagnostic(new Diagnostic(ErrorKind.RECURSION_HALTED,
                        "recursive call to '" + graph.scope(callee).name() + "' not expanded further", site.location()));
                    continue;
                }
                if (maxCallDepth >= 0 && frame.depth() + 1 > maxCallDepth) {
                    truncate(site, maxCallDepth);
                    handled.set(site.id());
                    reached.set(callee);
                    continue;
                }
                bind(site, graph.scope(callee));
                handled.set(site.id());
                if (!reached.get(callee)) {
                    reached.set(callee);
                    List<Long> chain = new ArrayList<>(frame.chain());
                    chain.add(key);
                    work.add(new Frame(callee, frame.depth() + 1, chain));
                }
            }
        }
    }

    /** Entry scopes head their own chain, so a cycle leading back to one is caught. */
    private static Frame rootFrame(int scopeId) {
        return new Frame(scopeId, 0, List.of(((long) scopeId << 32) | 0xffffffffL));
    }

    private static boolean onChain(List<Long> chain, int scopeId) {
        for (long key : chain) {
            if ((int) (key >>> 32) == scopeId) return true;
        }
        return false;
    }

    // ---- resolution ----

    /** Scope id of the function a call reaches, or -1. */
    int resolve(CallSite site) {
        String name = site.calleeName();
        if (name == null) return -1;
        Scope caller = graph.scope(site.callerScopeId());
        boolean java = caller.file().endsWith(".java");

        Scope cls = site.receiver() == CallSite.Receiver.NONE ? findClass(name, caller.file()) : null;
        if (site.construction() || cls != null) {
            return cls == null ? -1 : constructorOf(cls, site, java);
        }

        switch (site.receiver()) {
            case NONE -> {
                for (Scope s = caller; s != null; s = s.parentId() < 0 ? null : graph.scope(s.parentId())) {
                    if (!java && s.kind() == ScopeKind.CLASS) continue;
                    int f = memberOf(s.id(), name, site, java);
                    if (f >= 0) return f;
                }
                return uniqueModuleFunction(name);
            }
            case SELF -> {
                Scope owner = caller.className() == null ? null : findClass(caller.className(), caller.file());
                return owner == null ? -1 : memberOf(owner.id(), name, site, java);
            }
            default -> {
                Scope owner = site.receiverText() == null ? null : findClass(site.receiverText(), caller.file());
                return owner == null ? -1 : memberOf(owner.id(), name, site, java);
            }
        }
    }

    /** A class of that name, preferring the caller's file, else the only one in the graph. */
    private Scope findClass(String name, String file) {
        List<Scope> classes = scopesByName.getOrDefault(name, List.of()).stream()
            .filter(s -> s.kind() == ScopeKind.CLASS).toList();
        for (Scope s : classes) {
            if (s.file().equals(file)) return s;
        }
        return classes.size() == 1 ? classes.get(0) : null;
    }

    private int constructorOf(Scope cls, CallSite site, boolean java) {
        return memberOf(cls.id(), java ? "<init>" : "__init__", site, java);
    }

    /** Function named {@code name} declared directly in scope {@code parentId}; Java overloads are picked by arity. */
    private int memberOf(int parentId, String name, CallSite site, boolean java) {
        Scope first = null;
        for (Scope s : scopesByName.getOrDefault(name, List.of())) {
            if (s.kind() != ScopeKind.FUNCTION || s.parentId() != parentId) continue;
            if (!java) return s.id();
            if (s.paramNames().size() == site.args().size()) return s.id();
            if (first == null) first = s;
        }
        return first == null ? -1 : first.id();
    }

    private int uniqueModuleFunction(String name) {
        int found = -1;
        for (Scope s : scopesByName.getOrDefault(name, List.of())) {
            if (s.kind() != ScopeKind.FUNCTION || graph.scope(s.parentId()).kind() != ScopeKind.MODULE) continue;
            if (found >= 0) return -1;
            found = s.id();
        }
        return found;
    }

    // ---- edges ----

    private void fallback(CallSite site) {
        for (int result : site.results()) {
            for (int source : site.allSources()) {
                graph.addEdge(source, result, EdgeKind.CALL_ARGUMENT, site.location());
            }
        }
    }

    private void bind(CallSite site, Scope callee) {
        List<String> names = callee.paramNames();
        List<Integer> params = callee.paramNodeIds();
        int offset = 0;
        if (!names.isEmpty() && (names.get(0).equals("self") || names.get(0).equals("cls"))
                && (site.receiver() != CallSite.Receiver.NONE || site.construction() || callee.simpleName().equals("__init__"))) {
            offset = 1;
        }

        BitSet bound = new BitSet(params.size());
        for (int i = 0; i < site.args().size(); i++) {
            CallSite.Argument arg = site.args().get(i);
            int p = offset + i;
            if (arg.starred()) {
                for (int q = p; q < params.size(); q++) {
                    bindArgument(site, arg, params.get(q));
                    bound.set(q);
                }
                break;
            }
            if (p >= params.size()) break;
            bindArgument(site, arg, params.get(p));
            bound.set(p);
        }
        for (CallSite.Argument kw : site.keywords()) {
            if (kw.name() == null) {
                for (int q = offset; q < params.size(); q++) {
                    if (!bound.get(q)) bindArgument(site, kw, params.get(q));
                }
                continue;
            }
            int p = names.indexOf(kw.name());
            if (p >= 0) {
                bindArgument(site, kw, params.get(p));
                bound.set(p);
            }
        }

        if (callee.returnNodeId() >= 0) {
            for (int result : site.results()) {
                graph.addEdge(callee.returnNodeId(), result, EdgeKind.RETURN_BINDING, site.location());
            }
        }
        if (site.construction() || callee.simpleName().equals("__init__") || callee.simpleName().equals("<init>")) {
            fallback(site);
        }
    }

    private void bindArgument(CallSite site, CallSite.Argument arg, int param) {
        if (arg.literal() && arg.sources().isEmpty()) {
            int literal = graph.addNode(new FlowNode(-1, arg.text(), NodeKind.LITERAL, site.callerScopeId(),
                site.location(), site.code(), arg.text(), InferredType.UNKNOWN, site.context(), false, null));
            graph.addEdge(literal, param, EdgeKind.PARAMETER_BINDING, site.location());
            return;
        }
        for (int source : arg.sources()) {
            graph.addEdge(source, param, EdgeKind.PARAMETER_BINDING, site.location());
        }
    }

    private void truncate(CallSite site, int maxCallDepth) {
        int marker = graph.addNode(new FlowNode(-1, "<truncated " + site.calleeText() + "()>", NodeKind.TRUNCATED,
            site.callerScopeId(), site.location(), site.code(), "call depth limit " + maxCallDepth,
            InferredType.UNKNOWN, site.context(), false, null));
        for (int source : site.allSources()) {
            graph.addEdge(source, marker, EdgeKind.CALL_ARGUMENT, site.location());
        }
        for (int result : site.results()) {
            graph.addEdge(marker, result, EdgeKind.CALL_ARGUMENT, site.location());
        }
        graph.addDiagnostic(new Diagnostic(ErrorKind.DEPTH_LIMIT_REACHED,
            "call to '" + site.calleeText() + "' not expanded past depth " + maxCallDepth, site.location()));
    }
}
