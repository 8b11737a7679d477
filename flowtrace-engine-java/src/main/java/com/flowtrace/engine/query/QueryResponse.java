package com.flowtrace.engine.query;

import com.flowtrace.engine.analysis.CalculationStep;
import com.flowtrace.engine.analysis.ImpactReport;
import com.flowtrace.engine.analysis.StateReport;
import com.flowtrace.engine.graph.Diagnostic;

import java.util.List;

/**
 * Everything one query produced. Only the parts the mode asks for are filled: {@code impact} is
 * null outside impact mode, and so on. {@code error} is set when the query as a whole failed
 * (timeout, invalid query); per-variable problems sit on the individual {@link FlowResult}.
 */
public record QueryResponse(
    String variable,
    AnalysisMode mode,
    List<String> files,
    List<FlowResult> results,
    ImpactReport impact,
    List<CalculationStep> calculationPath,
    List<StateReport> states,
    List<VariableSummary> summary,
    List<Diagnostic> diagnostics,
    QueryError error
) {

    public static QueryResponse failed(FlowQuery query, QueryError error, List<Diagnostic> diagnostics) {
        return new QueryResponse(query.variable(), query.mode(), List.of(), List.of(), null, null, null, null,
            List.copyOf(diagnostics), error);
    }

    public boolean ok() {
        return error == null;
    }
}
