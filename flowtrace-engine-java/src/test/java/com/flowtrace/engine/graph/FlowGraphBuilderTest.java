package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.SourceAdapters;
import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FlowGraphBuilderTest {

    private final FlowGraphBuilder builder = new FlowGraphBuilder(new EngineConfigReader().defaults());

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

    private static boolean edge(FlowGraph g, FlowNode from, FlowNode to) {
        return g.outgoing(from.id()).stream().anyMatch(e -> e.to() == to.id());
    }

    private static FlowEdge edgeBetween(FlowGraph g, FlowNode from, FlowNode to) {
        return g.outgoing(from.id()).stream().filter(e -> e.to() == to.id()).findFirst().orElseThrow();
    }

    @Test
    void everyWriteIsANewVersion() {
        FlowGraph g = build("m.py", """
            x = 1
            y = x
            x = y + 1
            """);
        assertEquals(2, g.versionsOf("x").size());
        assertTrue(edge(g, node(g, "x", 1), node(g, "y", 2)));
        assertTrue(edge(g, node(g, "y", 2), node(g, "x", 3)));
        assertFalse(edge(g, node(g, "x", 1), node(g, "x", 3)));
        assertEquals(new InferredType.Known("int", false), node(g, "x", 1).type());
    }

    @Test
    void tupleAssignmentPairsElementwise() {
        FlowGraph g = build("m.py", """
            c = 5
            a, b = 1, c
            """);
        assertTrue(edge(g, node(g, "c", 1), node(g, "b", 2)));
        assertTrue(g.incoming(node(g, "a", 2).id()).isEmpty());
    }

    @Test
    void tupleUnpackingFromOneValueFeedsEveryTarget() {
        FlowGraph g = build("m.py", """
            pair = (1, 2)
            a, b = pair
            """);
        FlowNode pair = node(g, "pair", 1);
        assertTrue(edge(g, pair, node(g, "a", 2)));
        assertTrue(edge(g, pair, node(g, "b", 2)));
    }

    @Test
    void comprehensionVariablesDoNotLeak() {
        FlowGraph g = build("m.py", """
            items = [1, 2]
            x = 10
            ys = [x * 2 for x in items]
            """);
        FlowNode ys = node(g, "ys", 3);
        assertTrue(edge(g, node(g, "items", 1), ys));
        assertFalse(edge(g, node(g, "x", 2), ys));
        assertEquals(1, g.versionsOf("x").size());
    }

    @Test
    void selfAttributesAreClassFields() {
        FlowGraph g = build("m.py", """
            class Cart:
                def __init__(self):
                    self.total = 0

                def add(self, price):
                    self.total += price
            """);
        FlowNode first = node(g, "self.total", 3);
        FlowNode second = node(g, "self.total", 6);
        assertEquals(NodeKind.FIELD, second.kind());
        assertEquals(EdgeKind.AUGMENTED, edgeBetween(g, first, second).kind());
        assertTrue(edge(g, node(g, "price", 5), second));
        assertEquals(2, g.versionsOf("total").size());
    }

    @Test
    void globalDeclarationWritesModuleVariable() {
        FlowGraph g = build("m.py", """
            count = 0
            def bump():
                global count
                count = count + 1
            """);
        FlowNode bumped = node(g, "count", 4);
        assertEquals(NodeKind.GLOBAL, bumped.kind());
        assertTrue(edge(g, node(g, "count", 1), bumped));
    }

    @Test
    void mutatingCallCreatesNewVersion() {
        FlowGraph g = build("m.py", """
            items = []
            value = 3
            items.append(value)
            """);
        FlowNode mutated = node(g, "items", 3);
        assertTrue(mutated.mutation());
        assertEquals(EdgeKind.AUGMENTED, edgeBetween(g, node(g, "items", 1), mutated).kind());
        assertEquals(EdgeKind.CALL_ARGUMENT, edgeBetween(g, node(g, "value", 2), mutated).kind());
    }

    @Test
    void sideEffectCallIsASink() {
        FlowGraph g = build("m.py", """
            msg = 'hi'
            print(msg)
            """);
        FlowNode sink = node(g, "print()", 2);
        assertEquals(NodeKind.SINK, sink.kind());
        assertEquals("console", sink.category());
        assertTrue(edge(g, node(g, "msg", 1), sink));
    }

    @Test
    void unresolvedNameBecomesExternalInput() {
        FlowGraph g = build("m.py", "y = undefined_name\n");
        FlowNode external = node(g, "undefined_name", 1);
        assertEquals(NodeKind.EXTERNAL, external.kind());
        assertTrue(edge(g, external, node(g, "y", 1)));
        assertTrue(g.diagnostics().stream().anyMatch(d -> d.kind() == ErrorKind.UNRESOLVED_REFERENCE));
    }

    @Test
    void returnSlotCollectsReturnedValues() {
        FlowGraph g = build("m.py", """
            def f(a):
                return a * 2
            """);
        FlowNode ret = node(g, "f.return", 2);
        assertEquals(NodeKind.RETURN, ret.kind());
        assertTrue(edge(g, node(g, "a", 1), ret));
        Scope f = g.scopes().stream().filter(s -> s.simpleName().equals("f")).findFirst().orElseThrow();
        assertEquals(ret.id(), f.returnNodeId());
        assertEquals(List.of("a"), f.paramNames());
    }

    @Test
    void callsAreRecordedForTheLinker() {
        FlowGraph g = build("m.py", """
            def f(a):
                return a
            r = f(1)
            """);
        assertEquals(1, g.callSites().size());
        CallSite site = g.callSites().get(0);
        assertEquals("f", site.calleeName());
        assertEquals(CallSite.Receiver.NONE, site.receiver());
        assertEquals(List.of(node(g, "r", 3).id()), site.results());
        assertTrue(site.args().get(0).literal());
    }

    @Test
    void parseFailureGivesEmptyGraph() {
        FlowGraph g = build("bad.py", "def broken(:\n");
        assertEquals(0, g.nodeCount());
        assertTrue(g.hasParseErrors());
    }

    @Test
    void javaLocalDeclarationShadowsField() {
        FlowGraph g = build("Acc.java", """
            class Acc {
                private int total;
                void reset() { total = 5; }
                int local() { int total = 1; return total; }
            }
            """);
        assertEquals(NodeKind.FIELD, node(g, "total", 2).kind());
        assertEquals(NodeKind.FIELD, node(g, "total", 3).kind());
        FlowNode local = node(g, "total", 4);
        assertEquals(NodeKind.LOCAL, local.kind());
        assertTrue(edge(g, local, node(g, "local.return", 4)));
    }

    @Test
    void mergeShiftsIdsOfLaterParts() {
        FlowGraph a = build("a.py", "x = 1\n");
        FlowGraph b = build("b.py", "y = 2\nz = y\n");
        FlowGraph merged = FlowGraph.merge(List.of(a, b));
        assertEquals(a.nodeCount() + b.nodeCount(), merged.nodeCount());
        FlowNode y = node(merged, "y", 1);
        assertTrue(edge(merged, y, node(merged, "z", 2)));
        assertEquals(List.of("a.py", "b.py"), merged.files());
    }
}
