package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Location;

import java.util.ArrayList;
import java.util.List;

/**
 * A call found by the builder. Edges for it are added by the linker: either parameter and return
 * bindings into a resolved callee, or the conservative argument-to-result fallback.
 *
 * @param calleeName   last segment of the callee ({@code f}, or {@code info} for {@code log.info})
 * @param calleeText   the callee as written
 * @param construction true for {@code new T(...)} and calls known to construct an object
 * @param results      nodes receiving the call's value (assignment targets or a call-result node)
 */
public record CallSite(
    int id,
    int callerScopeId,
    String calleeName,
    String calleeText,
    Receiver receiver,
    String receiverText,
    boolean construction,
    List<Argument> args,
    List<Argument> keywords,
    List<Integer> receiverSources,
    List<Integer> results,
    Location location,
    String code,
    ControlContext context
) {

    public enum Receiver { NONE, SELF, OTHER }

    /**
     * One argument. {@code name} is the keyword, null for positional arguments and for {@code **kw}
     * (which has {@code starred} set).
     */
    public record Argument(String name, String text, boolean literal, boolean starred, List<Integer> sources) {

        Argument shifted(int nodeOffset) {
            return new Argument(name, text, literal, starred, sources.stream().map(n -> n + nodeOffset).toList());
        }
    }

    public CallSite withId(int newId) {
        return new CallSite(newId, callerScopeId, calleeName, calleeText, receiver, receiverText, construction,
            args, keywords, receiverSources, results, location, code, context);
    }

    CallSite shifted(int callOffset, int scopeOffset, int nodeOffset) {
        return new CallSite(id + callOffset, callerScopeId + scopeOffset, calleeName, calleeText, receiver,
            receiverText, construction,
            args.stream().map(a -> a.shifted(nodeOffset)).toList(),
            keywords.stream().map(a -> a.shifted(nodeOffset)).toList(),
            receiverSources.stream().map(n -> n + nodeOffset).toList(),
            results.stream().map(n -> n + nodeOffset).toList(),
            location, code, context);
    }

    /** Every node flowing into the call: receiver, positional and keyword arguments. */
    public List<Integer> allSources() {
        List<Integer> all = new ArrayList<>(receiverSources);
        for (Argument a : args) all.addAll(a.sources());
        for (Argument a : keywords) all.addAll(a.sources());
        return all;
    }
}
