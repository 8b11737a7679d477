package com.flowtrace.engine.analysis;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.ast.SourceAdapters;
import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.graph.EdgeKind;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowGraphBuilder;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.graph.InferredType;
import com.flowtrace.engine.graph.NodeKind;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CalculationPathExtractorTest {

    private final CalculationPathExtractor extractor = new CalculationPathExtractor();

    private static List<String> names(List<CalculationStep> steps) {
        return steps.stream().map(CalculationStep::name).toList();
    }

    @Test
    void stepsFollowDependenciesInSourceOrder() {
        SourceFile file = SourceFile.of("m.py", """
            a = 1
            b = 2
            c = a + b
            d = c * 2
            e = 99
            """);
        FlowGraph g = new FlowGraphBuilder(new EngineConfigReader().defaults())
            .build(SourceAdapters.forLanguage(file.language()).parse(file));
        int d = g.versionsOf("d").get(0);

        List<CalculationStep> steps = extractor.extract(g, d);
        assertEquals(List.of("a", "b", "c", "d"), names(steps));
        assertEquals(List.of("a@1", "b@2"), steps.get(2).inputs());
        assertEquals("c * 2", steps.get(3).expression());
    }

    @Test
    void sharedInputOfADiamondAppearsOnce() {
        SourceFile file = SourceFile.of("m.py", """
            a = 1
            b = a
            c = a
            d = b + c
            """);
        FlowGraph g = new FlowGraphBuilder(new EngineConfigReader().defaults())
            .build(SourceAdapters.forLanguage(file.language()).parse(file));

        List<CalculationStep> steps = extractor.extract(g, g.versionsOf("d").get(0));
        assertEquals(List.of("a", "b", "c", "d"), names(steps));
        assertEquals(1, steps.stream().filter(s -> s.name().equals("a")).count());
        assertEquals(List.of("b@2", "c@3"), steps.get(3).inputs());
    }

    private static FlowGraph cyclic() {
        FlowGraph g = new FlowGraph();
        for (String name : List.of("a", "b", "c")) {
            g.addNode(new FlowNode(-1, name, NodeKind.LOCAL, 0, new Location("t.py", g.nodeCount() + 1), "", "",
                InferredType.UNKNOWN, ControlContext.TOP, false, null));
        }
        g.addEdge(0, 1, EdgeKind.ASSIGNMENT, new Location("t.py", 2));
        g.addEdge(1, 2, EdgeKind.ASSIGNMENT, new Location("t.py", 3));
        g.addEdge(2, 1, EdgeKind.AUGMENTED, new Location("t.py", 2));
        return g;
    }

    @Test
    void cycleIsBrokenInSourceOrder() {
        List<CalculationStep> steps = extractor.extract(cyclic(), 2);
        assertEquals(List.of("a", "b", "c"), names(steps));
    }

    @Test
    void walkStopsAtTheTarget() {
        List<CalculationStep> steps = extractor.extract(cyclic(), 1);
        assertEquals(List.of("a", "b"), names(steps));
    }

    @Test
    void nodeWithoutInputsIsItsOwnPath() {
        List<CalculationStep> steps = extractor.extract(cyclic(), 0);
        assertEquals(1, steps.size());
        assertTrue(steps.get(0).inputs().isEmpty());
    }
}
