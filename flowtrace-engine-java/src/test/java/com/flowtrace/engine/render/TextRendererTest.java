package com.flowtrace.engine.render;

import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.query.AnalysisMode;
import com.flowtrace.engine.query.Direction;
import com.flowtrace.engine.query.FlowEngine;
import com.flowtrace.engine.query.FlowQuery;
import com.flowtrace.engine.query.QueryResponse;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextRendererTest {

    private static final String SOURCE = """
        x = 1
        y = x
        z = y
        w = 5
        """;

    private final FlowEngine engine = new FlowEngine(new EngineConfigReader().defaults());

    private QueryResponse run(FlowQuery query) {
        return engine.run(query, List.of(SourceFile.of("m.py", SOURCE)));
    }

    @Test
    void forwardReport() {
        String text = new TextRenderer().render(run(FlowQuery.builder("x").build()));
        assertTrue(text.contains("Data flow analysis for 'x' (forward)"));
        assertTrue(text.contains("This variable affects:"));
        assertTrue(text.contains("→ z at m.py:3 (depth: 2)"));
        assertTrue(text.contains("x → y → z"));
        assertTrue(text.contains("Total: 2"));
    }

    @Test
    void emptyBackwardReport() {
        String text = new TextRenderer().render(run(FlowQuery.builder("w").direction(Direction.BACKWARD).build()));
        assertTrue(text.contains("No dependencies found."));
    }

    @Test
    void affectedLinesOnly() {
        String text = new TextRenderer(true).render(run(FlowQuery.builder("x").build()));
        assertEquals("2\n3\n", text);
    }

    @Test
    void calculationAndSummarySections() {
        String calc = new TextRenderer().render(run(FlowQuery.builder("z").mode(AnalysisMode.CALC_PATH).build()));
        assertTrue(calc.contains("Calculation Path"));
        assertTrue(calc.contains("3. z = y"));
        assertTrue(calc.contains("Inputs: y@2"));

        String all = new TextRenderer().render(run(FlowQuery.builder(null).mode(AnalysisMode.SHOW_ALL).build()));
        assertTrue(all.contains("y (defined at m.py:2)"));
        assertTrue(all.contains("  depends on: x"));
    }

    @Test
    void errorResponse() {
        String text = new TextRenderer().render(run(FlowQuery.builder("x").timeoutSeconds(0).build()));
        assertTrue(text.startsWith("Error (invalid_query)"));
    }
}
