package com.flowtrace.engine.analysis;

import com.flowtrace.engine.ast.SourceAdapters;
import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowGraphBuilder;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeStateTrackerTest {

    private final TypeStateTracker tracker = new TypeStateTracker();

    private List<StateReport> track(String source, String variable) {
        SourceFile file = SourceFile.of("m.py", source);
        FlowGraph g = new FlowGraphBuilder(new EngineConfigReader().defaults())
            .build(SourceAdapters.forLanguage(file.language()).parse(file));
        return tracker.track(g, variable);
    }

    private static long count(StateReport report, StateWarning.Kind kind) {
        return report.warnings().stream().filter(w -> w.kind() == kind).count();
    }

    @Test
    void typeChainAcrossReassignments() {
        List<StateReport> reports = track("""
            def load(path):
                result = None
                result = {}
                result = Record(path)
                return result
            """, "result");

        assertEquals(1, reports.size());
        StateReport report = reports.get(0);
        assertEquals("load", report.scope());
        assertEquals(List.of("NoneType", "dict", "Record"), report.typeChain());
        assertEquals(2, count(report, StateWarning.Kind.TYPE_CHANGE));
        StateWarning possibleNull = report.warnings().stream()
            .filter(w -> w.kind() == StateWarning.Kind.POSSIBLE_NULL).findFirst().orElseThrow();
        assertEquals(2, possibleNull.location().line());
        assertEquals(List.of("assignment", "assignment", "assignment"),
            report.events().stream().map(TypeEvent::event).toList());
    }

    @Test
    void unknownVersionsDoNotChangeType() {
        StateReport report = track("""
            x = 1
            x = compute()
            x = 2
            """, "x").get(0);
        assertEquals(List.of("int"), report.typeChain());
        assertEquals(0, count(report, StateWarning.Kind.TYPE_CHANGE));
    }

    @Test
    void loopAndBranchModifications() {
        StateReport report = track("""
            def f(items):
                total = 0
                for item in items:
                    if item:
                        total += item
                return total
            """, "total").get(0);
        assertEquals(1, count(report, StateWarning.Kind.MODIFIED_IN_LOOP));
        assertEquals(1, count(report, StateWarning.Kind.MODIFIED_IN_CONDITIONAL));
        assertEquals(5, report.warnings().get(0).location().line());
    }

    @Test
    void parametersAreNotModifications() {
        StateReport report = track("""
            def f(items: list):
                for item in items:
                    pass
            """, "items").get(0);
        assertEquals("parameter", report.events().get(0).event());
        assertEquals(List.of("list"), report.typeChain());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void mutationEvent() {
        StateReport report = track("""
            seen = []
            seen.append(1)
            """, "seen").get(0);
        assertEquals(List.of("assignment", "mutation"),
            report.events().stream().map(TypeEvent::event).toList());
        assertEquals(List.of("list"), report.typeChain());
    }

    @Test
    void eachScopeGetsItsOwnReport() {
        List<StateReport> reports = track("""
            value = 1
            def f():
                value = 'text'
            """, "value");
        assertEquals(2, reports.size());
        assertEquals(List.of("<module>", "f"), reports.stream().map(StateReport::scope).toList());
    }
}
