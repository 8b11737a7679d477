package com.flowtrace.engine.render;

import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.query.Direction;
import com.flowtrace.engine.query.FlowEngine;
import com.flowtrace.engine.query.FlowQuery;
import com.flowtrace.engine.query.QueryResponse;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class DotRendererTest {

    @Test
    void tracedSubgraph() {
        QueryResponse response = new FlowEngine(new EngineConfigReader().defaults()).run(
            FlowQuery.builder("y").direction(Direction.BOTH).build(),
            List.of(SourceFile.of("m.py", "x = 1\ny = x\nz = y\n")));
        String dot = new DotRenderer().render(response);

        assertTrue(dot.startsWith("digraph dataflow {"));
        assertTrue(dot.contains("n1 [label=\"y\\nm.py:2\", style=filled, fillcolor=lightblue];"));
        assertTrue(dot.contains("n0 -> n1 [label=\"assignment\"];"));
        assertTrue(dot.contains("n1 -> n2 [label=\"assignment\"];"));
        assertEquals(1, Pattern.compile("(?m)^  n1 \\[label").matcher(dot).results().count());
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    void nodeSharedByTwoResultsIsDeclaredOnce() {
        QueryResponse response = new FlowEngine(new EngineConfigReader().defaults()).run(
            FlowQuery.builder("b").direction(Direction.BOTH).build(),
            List.of(SourceFile.of("m.py", "a = 1\nb = a\nc = b\n")));
        String dot = new DotRenderer().render(response);

        long declarations = dot.lines().filter(line -> line.startsWith("  n1 [label=")).count();
        long edges = dot.lines().filter(line -> line.contains(" -> ")).count();
        assertEquals(1, declarations);
        assertEquals(2, edges);
    }

    @Test
    void escapesQuotes() {
        assertEquals("say \\\"hi\\\"", DotRenderer.escape("say \"hi\""));
    }
}
