package com.flowtrace.engine.render;

import com.flowtrace.engine.analysis.CalculationStep;
import com.flowtrace.engine.analysis.ExitCategory;
import com.flowtrace.engine.analysis.ExitPoint;
import com.flowtrace.engine.analysis.ImpactReport;
import com.flowtrace.engine.analysis.StateReport;
import com.flowtrace.engine.analysis.StateWarning;
import com.flowtrace.engine.analysis.TypeEvent;
import com.flowtrace.engine.graph.Diagnostic;
import com.flowtrace.engine.query.Direction;
import com.flowtrace.engine.query.FlowResult;
import com.flowtrace.engine.query.QueryResponse;
import com.flowtrace.engine.query.VariableSummary;

import java.util.stream.Collectors;

/**
 * Human-readable report. With {@code affectedLinesOnly} each flow result is reduced to its sorted
 * line numbers, one per line, for piping into other tools.
 */
public class TextRenderer {

    private static final String RULE = "=".repeat(60);

    private final boolean affectedLinesOnly;

    public TextRenderer() {
        this(false);
    }

    public TextRenderer(boolean affectedLinesOnly) {
        this.affectedLinesOnly = affectedLinesOnly;
    }

    public String render(QueryResponse response) {
        StringBuilder out = new StringBuilder();
        if (response.error() != null) {
            out.append("Error (").append(response.error().kind().id()).append("): ")
               .append(response.error().message()).append('\n');
            return out.toString();
        }
        for (FlowResult r : response.results()) flow(out, r);
        if (affectedLinesOnly) return out.toString();

        if (response.impact() != null) impact(out, response.impact());
        if (response.calculationPath() != null) calculation(out, response);
        if (response.states() != null) {
            for (StateReport s : response.states()) state(out, s);
        }
        if (response.summary() != null) summary(out, response);
        if (!response.diagnostics().isEmpty()) {
            out.append("\nDiagnostics:\n");
            for (Diagnostic d : response.diagnostics()) out.append("  ").append(d).append('\n');
        }
        return out.toString();
    }

    private void flow(StringBuilder out, FlowResult r) {
        if (affectedLinesOnly) {
            for (int line : r.affectedLines()) out.append(line).append('\n');
            return;
        }
        out.append("\nData flow analysis for '").append(r.variable()).append("' (").append(r.direction().id())
           .append("):\n").append("-".repeat(50)).append('\n');
        if (r.error() != null) {
            out.append("Error (").append(r.error().kind().id()).append("): ").append(r.error().message()).append('\n');
            return;
        }
        boolean forward = r.direction() == Direction.FORWARD;
        if (r.entries().isEmpty()) {
            out.append(forward ? "No dependents found.\n" : "No dependencies found.\n");
            return;
        }
        out.append(forward ? "\nThis variable affects:\n" : "\nThis variable depends on:\n");
        for (FlowResult.Entry e : r.entries()) {
            out.append(forward ? "  → " : "  ← ").append(e.name()).append(" at ").append(e.location())
               .append(" (depth: ").append(e.depth()).append(")\n");
        }
        if (!r.flowPaths().isEmpty()) {
            out.append("\nFlow paths:\n");
            for (String p : r.flowPaths()) out.append("  ").append(p).append('\n');
        }
        out.append("\nTotal: ").append(r.totalCount()).append('\n');
        if (r.truncated()) out.append("(stopped at the depth limit)\n");
    }

    private static void impact(StringBuilder out, ImpactReport report) {
        out.append('\n').append(RULE).append("\nImpact Analysis\n").append(RULE).append('\n');
        section(out, report, ExitCategory.RETURN, "RETURNS");
        section(out, report, ExitCategory.SIDE_EFFECT, "SIDE EFFECTS");
        section(out, report, ExitCategory.STATE_CHANGE, "STATE CHANGES");
        out.append("\nSUMMARY:\n")
           .append("  Total exit points: ").append(report.exitPoints().size()).append('\n')
           .append("  Functions affected: ").append(report.functionsTouched()).append('\n')
           .append("  Risk: ").append(report.risk().id()).append('\n')
           .append("\n  ").append(report.recommendation()).append('\n')
           .append("\n  Note: ").append(report.note()).append('\n');
    }

    private static void section(StringBuilder out, ImpactReport report, ExitCategory category, String title) {
        if (report.count(category) == 0) return;
        out.append('\n').append(title).append(":\n");
        for (ExitPoint p : report.exitPoints()) {
            if (p.category() != category) continue;
            out.append("  - ").append(p.subType()).append(" in ").append(p.function()).append(" at ")
               .append(p.location()).append('\n')
               .append("    ").append(p.description()).append('\n');
        }
    }

    private static void calculation(StringBuilder out, QueryResponse response) {
        out.append('\n').append(RULE).append("\nCalculation Path\n").append(RULE).append('\n');
        int i = 1;
        for (CalculationStep s : response.calculationPath()) {
            out.append(i++).append(". ").append(s.name());
            if (s.expression() != null && !s.expression().isEmpty()) out.append(" = ").append(s.expression());
            out.append('\n');
            if (!s.inputs().isEmpty()) out.append("   Inputs: ").append(String.join(", ", s.inputs())).append('\n');
            out.append("   Location: ").append(s.location()).append('\n');
        }
    }

    private static void state(StringBuilder out, StateReport s) {
        out.append('\n').append(RULE).append("\nType & State Evolution for '").append(s.variable()).append("' in ")
           .append(s.scope()).append('\n').append(RULE).append('\n');
        out.append("TYPE EVOLUTION:\n");
        for (TypeEvent e : s.events()) {
            out.append("  ").append(e.location()).append(": ").append(e.type().display());
            if (e.nullable()) out.append(" (nullable)");
            out.append(" [").append(e.event()).append("]\n");
        }
        if (!s.typeChain().isEmpty()) {
            out.append("  Chain: ").append(String.join(" → ", s.typeChain())).append('\n');
        }
        if (!s.warnings().isEmpty()) {
            out.append("\nWARNINGS:\n");
            for (StateWarning w : s.warnings()) {
                out.append("  - ").append(w.kind().id()).append(" at ").append(w.location()).append(": ")
                   .append(w.message()).append('\n');
            }
        }
    }

    private static void summary(StringBuilder out, QueryResponse response) {
        out.append('\n').append(RULE).append("\nVariables\n").append(RULE).append('\n');
        for (VariableSummary v : response.summary()) {
            out.append(v.name()).append(" (defined at ")
               .append(v.definitions().stream().map(Object::toString).collect(Collectors.joining(", ")))
               .append(")\n");
            if (!v.dependsOn().isEmpty()) out.append("  depends on: ").append(String.join(", ", v.dependsOn())).append('\n');
            if (!v.dependents().isEmpty()) out.append("  affects: ").append(String.join(", ", v.dependents())).append('\n');
        }
    }
}
