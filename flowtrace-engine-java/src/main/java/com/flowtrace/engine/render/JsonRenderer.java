package com.flowtrace.engine.render;

import com.flowtrace.engine.analysis.CalculationStep;
import com.flowtrace.engine.analysis.ExitCategory;
import com.flowtrace.engine.analysis.ExitPoint;
import com.flowtrace.engine.analysis.ImpactReport;
import com.flowtrace.engine.analysis.StateReport;
import com.flowtrace.engine.analysis.StateWarning;
import com.flowtrace.engine.analysis.TypeEvent;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.graph.Diagnostic;
import com.flowtrace.engine.query.Direction;
import com.flowtrace.engine.query.FlowResult;
import com.flowtrace.engine.query.QueryError;
import com.flowtrace.engine.query.QueryResponse;
import com.flowtrace.engine.query.VariableSummary;
import com.flowtrace.engine.render.JsonModel.*;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Maps a {@link QueryResponse} onto {@link JsonModel} and prints it with Gson. Every list keeps
 * the engine's deterministic order, so the same sources always give byte-identical output.
 */
public class JsonRenderer {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public String render(QueryResponse response) {
        return gson.toJson(toModel(response));
    }

    JsonResponse toModel(QueryResponse response) {
        JsonResponse root = new JsonResponse();
        root.variable = response.variable();
        root.mode = response.mode().id();
        root.files = response.files();
        root.results = new ArrayList<>();
        for (FlowResult r : response.results()) root.results.add(result(r));
        if (response.impact() != null) root.impact = impact(response.impact());
        if (response.calculationPath() != null) {
            root.calculationPath = new ArrayList<>();
            for (CalculationStep s : response.calculationPath()) root.calculationPath.add(step(s));
        }
        if (response.states() != null) {
            root.states = new ArrayList<>();
            for (StateReport s : response.states()) root.states.add(state(s));
        }
        if (response.summary() != null) {
            root.variables = new ArrayList<>();
            for (VariableSummary s : response.summary()) root.variables.add(summary(s));
        }
        root.diagnostics = new ArrayList<>();
        for (Diagnostic d : response.diagnostics()) {
            JsonDiagnostic jd = new JsonDiagnostic();
            jd.kind = d.kind().id();
            jd.message = d.message();
            jd.location = d.location() == null ? null : d.location().toString();
            root.diagnostics.add(jd);
        }
        root.error = error(response.error());
        return root;
    }

    private static JsonFlowResult result(FlowResult r) {
        JsonFlowResult jr = new JsonFlowResult();
        jr.variable = r.variable();
        jr.direction = r.direction().id();
        List<JsonEntry> entries = new ArrayList<>();
        for (FlowResult.Entry e : r.entries()) {
            JsonEntry je = new JsonEntry();
            je.name = e.name();
            je.kind = e.kind().id();
            je.location = e.location().toString();
            je.function = e.function();
            je.code = e.code();
            je.expression = e.expression();
            je.depth = e.depth();
            entries.add(je);
        }
        if (r.direction() == Direction.FORWARD) jr.affects = entries;
        else jr.dependsOn = entries;
        jr.flowPaths = r.flowPaths();
        jr.totalCount = r.totalCount();
        jr.affectedLines = r.affectedLines();
        jr.truncated = r.truncated();
        jr.error = error(r.error());
        return jr;
    }

    private static JsonImpact impact(ImpactReport report) {
        JsonImpact ji = new JsonImpact();
        ji.exitPoints = new ArrayList<>();
        for (ExitPoint p : report.exitPoints()) {
            JsonExitPoint jp = new JsonExitPoint();
            jp.type = p.category().id();
            jp.subType = p.subType();
            jp.function = p.function();
            jp.location = p.location().toString();
            jp.description = p.description();
            ji.exitPoints.add(jp);
        }
        ji.counts = new LinkedHashMap<>();
        for (ExitCategory c : ExitCategory.values()) ji.counts.put(c.id(), report.count(c));
        ji.functionsTouched = report.functionsTouched();
        ji.risk = report.risk().id();
        ji.recommendation = report.recommendation();
        ji.heuristic = report.heuristic();
        ji.note = report.note();
        return ji;
    }

    private static JsonStep step(CalculationStep s) {
        JsonStep js = new JsonStep();
        js.name = s.name();
        js.kind = s.kind().id();
        js.location = s.location().toString();
        js.code = s.code();
        js.expression = s.expression();
        js.inputs = s.inputs();
        return js;
    }

    private static JsonState state(StateReport s) {
        JsonState js = new JsonState();
        js.scope = s.scope();
        js.typeChain = s.typeChain();
        js.events = new ArrayList<>();
        for (TypeEvent e : s.events()) {
            JsonEvent je = new JsonEvent();
            je.event = e.event();
            je.type = e.type().display();
            je.nullable = e.nullable();
            je.location = e.location().toString();
            je.expression = e.expression();
            je.inLoop = e.context().inLoop();
            je.inConditional = e.context().inConditional();
            js.events.add(je);
        }
        js.warnings = new ArrayList<>();
        for (StateWarning w : s.warnings()) {
            JsonWarning jw = new JsonWarning();
            jw.kind = w.kind().id();
            jw.message = w.message();
            jw.location = w.location().toString();
            js.warnings.add(jw);
        }
        return js;
    }

    private static JsonSummary summary(VariableSummary s) {
        JsonSummary js = new JsonSummary();
        js.name = s.name();
        js.definitions = s.definitions().stream().map(Location::toString).toList();
        js.dependsOn = s.dependsOn();
        js.dependents = s.dependents();
        return js;
    }

    private static JsonError error(QueryError error) {
        if (error == null) return null;
        JsonError je = new JsonError();
        je.kind = error.kind().id();
        je.message = error.message();
        return je;
    }
}
