package com.flowtrace.engine.query;

import com.flowtrace.engine.analysis.CalculationStep;
import com.flowtrace.engine.analysis.ExitCategory;
import com.flowtrace.engine.analysis.RiskLevel;
import com.flowtrace.engine.analysis.StateReport;
import com.flowtrace.engine.analysis.StateWarning;
import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.graph.ErrorKind;
import com.flowtrace.engine.render.JsonRenderer;
import com.flowtrace.engine.source.ParseCache;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FlowEngineTest {

    private static final Path FIXTURES =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures");

    private final FlowEngine engine = new FlowEngine(new EngineConfigReader().defaults());

    private static final String CHAIN = """
        x = 1
        y = x
        z = y
        result = z
        """;

    private QueryResponse run(FlowQuery query, String source) {
        return engine.run(query, List.of(SourceFile.of("m.py", source)));
    }

    private static Set<String> names(FlowResult result) {
        return result.entries().stream().map(FlowResult.Entry::name).collect(Collectors.toSet());
    }

    @Test
    void forwardChainListsEveryDownstreamVariable() {
        QueryResponse response = run(FlowQuery.builder("x").build(), CHAIN);

        assertTrue(response.ok());
        FlowResult forward = response.results().get(0);
        assertEquals(Direction.FORWARD, forward.direction());
        assertEquals(List.of("y", "z", "result"), forward.entries().stream().map(FlowResult.Entry::name).toList());
        assertEquals(List.of(1, 2, 3), forward.entries().stream().map(FlowResult.Entry::depth).toList());
        assertEquals(List.of("x → y → z → result"), forward.flowPaths());
        assertEquals(3, forward.totalCount());
        assertEquals(List.of(2, 3, 4), forward.affectedLines());
        assertFalse(forward.truncated());
    }

    @Test
    void depthLimitCutsTheChain() {
        FlowResult forward = run(FlowQuery.builder("x").maxDepth(0).build(), CHAIN).results().get(0);
        assertEquals(Set.of("y"), names(forward));
        assertTrue(forward.truncated());
    }

    @Test
    void bothDirectionsGiveTwoResults() {
        QueryResponse response = run(FlowQuery.builder("z").direction(Direction.BOTH).build(), CHAIN);
        assertEquals(2, response.results().size());
        assertEquals(Set.of("result"), names(response.results().get(0)));
        assertEquals(Set.of("x", "y"), names(response.results().get(1)));
        assertEquals(List.of("x → y → z"), response.results().get(1).flowPaths());
    }

    @Test
    void independentVariablesHaveNoDependencies() {
        FlowResult backward = run(FlowQuery.builder("a").direction(Direction.BACKWARD).build(), """
            a = 1
            b = 2
            c = 3
            """).results().get(0);
        assertTrue(backward.found());
        assertTrue(backward.entries().isEmpty());
        assertEquals(0, backward.totalCount());
    }

    @Test
    void unknownVariableIsNotFound() {
        FlowResult result = run(FlowQuery.builder("missing").build(), CHAIN).results().get(0);
        assertFalse(result.found());
        assertEquals(ErrorKind.VARIABLE_NOT_FOUND, result.error().kind());
    }

    @Test
    void interProceduralBindingReachesTheLiteralArgument() {
        String source = """
            def f(x):
                return x * 2

            result = f(5)
            """;
        FlowQuery query = FlowQuery.builder("result").direction(Direction.BACKWARD).interProcedural(true).build();
        FlowResult backward = run(query, source).results().get(0);
        assertEquals(Set.of("f.return", "x", "5"), names(backward));
        assertEquals(List.of("5 → x → f.return → result"), backward.flowPaths());

        FlowQuery intra = FlowQuery.builder("result").direction(Direction.BACKWARD).build();
        assertTrue(run(intra, source).results().get(0).entries().isEmpty());
    }

    @Test
    void forwardAndBackwardAgree() {
        FlowQuery.Builder scope = FlowQuery.builder("discounted").scope(FIXTURES.resolve("python"));
        QueryResponse forward = engine.run(scope.build());
        for (String reached : names(forward.results().get(0))) {
            if (reached.endsWith("()") || reached.contains(".return")) continue;
            FlowQuery back = FlowQuery.builder(reached).scope(FIXTURES.resolve("python"))
                .direction(Direction.BACKWARD).build();
            assertTrue(names(engine.run(back).results().get(0)).contains("discounted"),
                "backward from " + reached + " should reach discounted");
        }
    }

    @Test
    void brokenFileIsReportedAndSkipped() {
        QueryResponse response = engine.run(FlowQuery.builder("total").scope(FIXTURES.resolve("python")).build());
        assertTrue(response.ok());
        assertEquals(3, response.files().size());
        assertTrue(response.diagnostics().stream()
            .anyMatch(d -> d.kind() == ErrorKind.PARSE_ERROR && d.location().file().endsWith("broken.py")));
        assertTrue(response.results().get(0).found());
    }

    @Test
    void impactOfPythonTotal() {
        QueryResponse response = engine.run(FlowQuery.builder("total").mode(AnalysisMode.IMPACT)
            .file(FIXTURES.resolve("python/pricing.py")).build());
        assertNotNull(response.impact());
        assertEquals(1, response.impact().count(ExitCategory.SIDE_EFFECT));
        assertTrue(response.impact().count(ExitCategory.STATE_CHANGE) >= 1);
        assertEquals(RiskLevel.MEDIUM, response.impact().risk());
    }

    @Test
    void impactOfJavaNet() {
        QueryResponse response = engine.run(FlowQuery.builder("net").mode(AnalysisMode.IMPACT)
            .scope(FIXTURES.resolve("java-invoicing")).recursive(true).build());
        assertEquals(1, response.files().size());
        assertEquals(1, response.impact().count(ExitCategory.SIDE_EFFECT));
        assertEquals(2, response.impact().count(ExitCategory.STATE_CHANGE));
        assertEquals(1, response.impact().count(ExitCategory.RETURN));
        assertEquals(RiskLevel.MEDIUM, response.impact().risk());
    }

    @Test
    void impactOfMissingVariableHasNoReport() {
        QueryResponse response = run(FlowQuery.builder("nope").mode(AnalysisMode.IMPACT).build(), CHAIN);
        assertNull(response.impact());
        assertFalse(response.results().get(0).found());
    }

    @Test
    void calculationPathEndsAtTheVariable() {
        QueryResponse response = engine.run(FlowQuery.builder("tax").mode(AnalysisMode.CALC_PATH)
            .file(FIXTURES.resolve("python/pricing.py")).interProcedural(true).build());
        List<CalculationStep> steps = response.calculationPath();
        assertEquals("tax", steps.get(steps.size() - 1).name());
        assertTrue(steps.stream().anyMatch(s -> s.name().equals("subtotal")));
        assertTrue(steps.stream().anyMatch(s -> s.name().equals("reduced")));
        FlowResult backward = response.results().get(0);
        assertTrue(steps.size() <= backward.totalCount() + backward.origins().size());
        assertEquals(steps.size(), steps.stream().map(CalculationStep::nodeId).distinct().count());
    }

    @Test
    void stateOfPythonResult() {
        QueryResponse response = engine.run(FlowQuery.builder("result").mode(AnalysisMode.STATE)
            .file(FIXTURES.resolve("python/records.py")).build());
        StateReport report = response.states().get(0);
        assertEquals("load", report.scope());
        assertEquals(List.of("NoneType", "dict", "Record"), report.typeChain());
        assertTrue(report.warnings().stream()
            .anyMatch(w -> w.kind() == StateWarning.Kind.POSSIBLE_NULL && w.location().line() == 2));
        assertTrue(report.warnings().stream().anyMatch(w -> w.kind() == StateWarning.Kind.MODIFIED_IN_LOOP));
    }

    @Test
    void stateOfJavaLabel() {
        QueryResponse response = engine.run(FlowQuery.builder("label").mode(AnalysisMode.STATE)
            .scope(FIXTURES.resolve("java-invoicing")).recursive(true).build());
        StateReport report = response.states().get(0);
        assertEquals("InvoiceCalculator.describe", report.scope());
        assertEquals(List.of("String"), report.typeChain());
        assertTrue(report.warnings().stream().anyMatch(w -> w.kind() == StateWarning.Kind.POSSIBLE_NULL));
        assertTrue(report.warnings().stream().anyMatch(w -> w.kind() == StateWarning.Kind.MODIFIED_IN_CONDITIONAL));
    }

    @Test
    void stateOfMissingVariable() {
        QueryResponse response = run(FlowQuery.builder("nope").mode(AnalysisMode.STATE).build(), CHAIN);
        assertNull(response.states());
        assertEquals(ErrorKind.VARIABLE_NOT_FOUND, response.results().get(0).error().kind());
    }

    @Test
    void showAllListsEveryVariable() {
        QueryResponse response = run(FlowQuery.builder(null).mode(AnalysisMode.SHOW_ALL).build(), CHAIN);
        List<VariableSummary> summary = response.summary();
        assertEquals(List.of("result", "x", "y", "z"), summary.stream().map(VariableSummary::name).toList());
        VariableSummary y = summary.get(2);
        assertEquals(List.of("x"), y.dependsOn());
        assertEquals(List.of("z"), y.dependents());
    }

    @Test
    void invalidQueries() {
        QueryResponse noVariable = run(FlowQuery.builder(null).build(), CHAIN);
        assertEquals(ErrorKind.INVALID_QUERY, noVariable.error().kind());
        assertTrue(noVariable.results().isEmpty());

        assertEquals(ErrorKind.INVALID_QUERY, run(FlowQuery.builder("x").maxDepth(-2).build(), CHAIN).error().kind());
        assertEquals(ErrorKind.INVALID_QUERY, run(FlowQuery.builder("x").timeoutSeconds(0).build(), CHAIN).error().kind());
    }

    @Test
    void repeatedQueriesRenderIdentically() {
        ParseCache cache = new ParseCache();
        FlowEngine cached = new FlowEngine(new EngineConfigReader().defaults(), cache);
        FlowQuery query = FlowQuery.builder("total").direction(Direction.BOTH).interProcedural(true)
            .scope(FIXTURES.resolve("python")).build();
        JsonRenderer renderer = new JsonRenderer();

        String first = renderer.render(cached.run(query));
        String second = renderer.render(cached.run(query));
        assertEquals(first, second);
        assertTrue(cache.hits() > 0);
    }

    @Test
    void cyclicCallGraphTerminates() {
        QueryResponse response = run(FlowQuery.builder("a").interProcedural(true).direction(Direction.BOTH).build(), """
            def ping(a):
                return pong(a)

            def pong(b):
                return ping(b)
            """);
        assertTrue(response.ok());
        assertTrue(names(response.results().get(0)).contains("b"));
        assertTrue(response.diagnostics().stream().anyMatch(d -> d.kind() == ErrorKind.RECURSION_HALTED));
    }

    @Test
    void chainedLiteralAssignmentGivesIndependentVariables() {
        String source = "a = b = c = 10\n";
        for (String name : List.of("a", "b", "c")) {
            QueryResponse response = run(FlowQuery.builder(name).direction(Direction.BACKWARD).build(), source);
            assertTrue(response.ok());
            FlowResult backward = response.results().get(0);
            assertTrue(backward.found(), name + " should be defined");
            assertTrue(backward.entries().isEmpty(), name + " should depend on nothing");
        }
    }

    @Test
    void longOperatorChainIsTraced() {
        StringBuilder chain = new StringBuilder("a = 1\ns = a");
        for (int i = 0; i < 3000; i++) chain.append(" + a");
        chain.append('\n');
        QueryResponse response = engine.run(FlowQuery.builder("a").build(), List.of(
            SourceFile.of("gen.py", chain.toString()),
            SourceFile.of("ok.py", "x = 1\ny = x\n")));

        assertTrue(response.ok());
        assertTrue(names(response.results().get(0)).contains("s"));
        assertTrue(response.diagnostics().stream().noneMatch(d -> d.kind() == ErrorKind.PARSE_ERROR));
    }

    @Test
    void fileTooDeepToAnalyzeDoesNotStopTheBatch() {
        String deep = "x = " + "(".repeat(100_000) + "1" + ")".repeat(100_000) + "\n";
        QueryResponse response = engine.run(FlowQuery.builder("y").direction(Direction.BACKWARD).build(), List.of(
            SourceFile.of("deep.py", deep),
            SourceFile.of("ok.py", "x = 1\ny = x\n")));

        assertTrue(response.ok());
        assertEquals(Set.of("x"), names(response.results().get(0)));
        assertTrue(response.diagnostics().stream()
            .anyMatch(d -> d.kind() == ErrorKind.PARSE_ERROR && d.location().file().equals("deep.py")));
    }

    @Test
    void slowQueryFailsWithTimeout() {
        StringBuilder source = new StringBuilder("v0 = 1\n");
        for (int i = 1; i < 20_000; i++) {
            source.append('v').append(i).append(" = v").append(i - 1).append(" + ").append(i).append('\n');
        }
        FlowEngine limited = new FlowEngine(new EngineConfigReader().defaults(), new ParseCache(), Duration.ofMillis(1));

        QueryResponse response = limited.run(FlowQuery.builder("v0").build(),
            List.of(SourceFile.of("big.py", source.toString())));

        assertFalse(response.ok());
        assertEquals(ErrorKind.TIMEOUT, response.error().kind());
        assertEquals("Query exceeded 1ms time limit", response.error().message());
        assertTrue(response.results().isEmpty());
    }

    @Test
    void skippedExplicitFilesAreReported(@TempDir Path tmp) throws IOException {
        Path kept = Files.writeString(tmp.resolve("kept.py"), "x = 1\ny = x\n");
        Path notes = Files.writeString(tmp.resolve("notes.txt"), "x = 2\n");
        Path gone = tmp.resolve("gone.py");

        QueryResponse response = engine.run(FlowQuery.builder("x").file(kept).file(notes).file(gone).build());

        assertTrue(response.ok());
        assertEquals(Set.of("y"), names(response.results().get(0)));
        List<String> messages = response.diagnostics().stream()
            .filter(d -> d.kind() == ErrorKind.PARSE_ERROR)
            .map(d -> d.message())
            .toList();
        assertEquals(List.of("unsupported file type: " + notes, "file not found: " + gone), messages);
    }
}
