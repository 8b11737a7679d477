package com.flowtrace.engine.link;

import com.flowtrace.engine.ast.SourceAdapters;
import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.graph.EdgeKind;
import com.flowtrace.engine.graph.ErrorKind;
import com.flowtrace.engine.graph.FlowEdge;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowGraphBuilder;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.graph.NodeKind;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphLinkerTest {

    private final FlowGraphBuilder builder = new FlowGraphBuilder(new EngineConfigReader().defaults());
    private final CallGraphLinker linker = new CallGraphLinker();

    private FlowGraph build(String path, String source) {
        SourceFile file = SourceFile.of(path, source);
        return builder.build(SourceAdapters.forLanguage(file.language()).parse(file));
    }

    private static FlowNode node(FlowGraph g, String name, int line) {
        return g.nodes().stream()
            .filter(n -> n.name().equals(name) && n.line() == line)
            .findFirst()
            .orElseThrow(() -> new AssertionError("no node " + name + "@" + line));
    }

    private static List<FlowEdge> edges(FlowGraph g, FlowNode from, FlowNode to) {
        return g.outgoing(from.id()).stream().filter(e -> e.to() == to.id()).toList();
    }

    private static final String CALLER = """
        def f(x):
            return x + 1

        result = f(5)
        """;

    @Test
    void literalArgumentBindsToParameterAndReturnFlowsBack() {
        FlowGraph g = build("m.py", CALLER);
        linker.link(g, true, -1);

        FlowNode literal = g.nodes().stream().filter(n -> n.kind() == NodeKind.LITERAL).findFirst().orElseThrow();
        assertEquals("5", literal.name());
        FlowNode param = node(g, "x", 1);
        assertEquals(EdgeKind.PARAMETER_BINDING, edges(g, literal, param).get(0).kind());
        FlowNode ret = node(g, "f.return", 2);
        FlowNode result = node(g, "result", 4);
        assertEquals(EdgeKind.RETURN_BINDING, edges(g, ret, result).get(0).kind());
    }

    @Test
    void linkingOffUsesArgumentToResultFallback() {
        FlowGraph g = build("m.py", """
            def f(x):
                return x

            a = 1
            b = f(a)
            """);
        linker.link(g, false, -1);

        assertEquals(EdgeKind.CALL_ARGUMENT, edges(g, node(g, "a", 4), node(g, "b", 5)).get(0).kind());
        assertTrue(edges(g, node(g, "a", 4), node(g, "x", 1)).isEmpty());
    }

    @Test
    void unresolvedCalleeFallsBack() {
        FlowGraph g = build("m.py", """
            a = 1
            b = external_lib.compute(a)
            """);
        linker.link(g, true, -1);
        assertFalse(edges(g, node(g, "a", 1), node(g, "b", 2)).isEmpty());
    }

    @Test
    void keywordArgumentsBindByName() {
        FlowGraph g = build("m.py", """
            def scale(value, factor=2):
                return value * factor

            n = 4
            out = scale(1, factor=n)
            """);
        linker.link(g, true, -1);
        assertEquals(EdgeKind.PARAMETER_BINDING, edges(g, node(g, "n", 4), node(g, "factor", 1)).get(0).kind());
        assertTrue(edges(g, node(g, "n", 4), node(g, "value", 1)).isEmpty());
    }

    @Test
    void methodCallOnSelfSkipsReceiverParameter() {
        FlowGraph g = build("m.py", """
            class Calc:
                def double(self, v):
                    return v * 2

                def run(self, w):
                    return self.double(w)
            """);
        linker.link(g, true, -1);
        assertFalse(edges(g, node(g, "w", 5), node(g, "v", 2)).isEmpty());
        assertTrue(edges(g, node(g, "w", 5), node(g, "self", 2)).isEmpty());
    }

    @Test
    void recursionIsBoundOnceAndReported() {
        FlowGraph g = build("m.py", """
            def fact(n):
                if n <= 1:
                    return 1
                return n * fact(n - 1)

            r = fact(5)
            """);
        linker.link(g, true, -1);
        assertTrue(g.diagnostics().stream().anyMatch(d -> d.kind() == ErrorKind.RECURSION_HALTED));
        FlowNode ret = node(g, "fact.return", 3);
        FlowNode recursive = node(g, "fact()", 4);
        assertEquals(EdgeKind.RETURN_BINDING, edges(g, ret, recursive).get(0).kind());
    }

    @Test
    void callDepthLimitLeavesTruncationMarker() {
        FlowGraph g = build("m.py", """
            def inner(a):
                return a

            def outer(b):
                return inner(b)

            seed = 1
            top = outer(seed)
            """);
        linker.link(g, true, 1);

        FlowNode marker = g.nodes().stream().filter(n -> n.kind() == NodeKind.TRUNCATED).findFirst().orElseThrow();
        assertEquals("<truncated inner()>", marker.name());
        assertFalse(edges(g, node(g, "b", 4), marker).isEmpty());
        assertFalse(edges(g, node(g, "seed", 7), node(g, "b", 4)).isEmpty());
        assertTrue(g.diagnostics().stream().anyMatch(d -> d.kind() == ErrorKind.DEPTH_LIMIT_REACHED));
    }

    @Test
    void javaConstructorAndOverloadResolution() {
        FlowGraph g = build("Shop.java", """
            class Shop {
                private int stock;
                Shop(int initial) { stock = initial; }
                int price(int qty) { return qty * 3; }
                int price(int qty, int discount) { return qty * 3 - discount; }
                int run() {
                    Shop s = new Shop(10);
                    int n = 2;
                    return price(n, 1);
                }
            }
            """);
        linker.link(g, true, -1);

        FlowNode initial = node(g, "initial", 3);
        assertEquals(NodeKind.LITERAL, g.node(g.incoming(initial.id()).get(0).from()).kind());
        FlowNode n = node(g, "n", 8);
        assertFalse(edges(g, n, node(g, "qty", 5)).isEmpty());
        assertTrue(edges(g, n, node(g, "qty", 4)).isEmpty());
    }
}
