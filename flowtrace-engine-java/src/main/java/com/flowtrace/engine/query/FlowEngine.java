package com.flowtrace.engine.query;

import com.flowtrace.engine.analysis.CalculationPathExtractor;
import com.flowtrace.engine.analysis.CalculationStep;
import com.flowtrace.engine.analysis.ImpactAnalyzer;
import com.flowtrace.engine.analysis.ImpactReport;
import com.flowtrace.engine.analysis.StateReport;
import com.flowtrace.engine.analysis.TypeStateTracker;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.config.EngineConfig;
import com.flowtrace.engine.graph.Diagnostic;
import com.flowtrace.engine.graph.ErrorKind;
import com.flowtrace.engine.graph.FlowEdge;
import com.flowtrace.engine.graph.FlowGraph;
import com.flowtrace.engine.graph.FlowGraphBuilder;
import com.flowtrace.engine.graph.FlowNode;
import com.flowtrace.engine.link.CallGraphLinker;
import com.flowtrace.engine.source.ParseCache;
import com.flowtrace.engine.source.SourceCollector;
import com.flowtrace.engine.source.SourceFile;
import com.flowtrace.engine.traverse.Reachability;
import com.flowtrace.engine.traverse.Traversal;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one query end to end: collect and read the files, parse and build a graph per file on a
 * worker pool, merge, link calls, then run the analysis the mode asks for.
 *
 * Linking starts only after every file is built. The whole query runs under the configured
 * wall-clock timeout; when it expires the response carries a single TIMEOUT error and no results.
 */
public class FlowEngine {

    public static class EngineException extends RuntimeException {
        public EngineException(String msg, Throwable cause) { super(msg, cause); }
    }

    private final EngineConfig config;
    private final ParseCache cache;
    private final Duration timeLimit;

    public FlowEngine(EngineConfig config) {
        this(config, new ParseCache());
    }

    /** Reuses a caller-owned cache; results for unchanged files are not parsed twice. */
    public FlowEngine(EngineConfig config, ParseCache cache) {
        this(config, cache, null);
    }

    /** A non-null {@code timeLimit} replaces the query and configured timeout. */
    FlowEngine(EngineConfig config, ParseCache cache, Duration timeLimit) {
        this.config = config;
        this.cache = cache;
        this.timeLimit = timeLimit;
    }

    public QueryResponse run(FlowQuery query) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        SourceCollector.Selection selection = new SourceCollector().select(query.files(), query.scope(),
            query.recursive(), query.include(), query.exclude());
        for (SourceCollector.Skipped s : selection.skipped()) {
            diagnostics.add(new Diagnostic(ErrorKind.PARSE_ERROR, s.reason() + ": " + s.path(),
                new Location(s.path().toString(), 0)));
        }
        List<SourceFile> sources = new ArrayList<>();
        for (Path p : selection.files()) {
            try {
                sources.add(SourceFile.read(p));
            } catch (SourceFile.SourceReadException e) {
                System.err.println("[flowtrace] Warning: " + e.getMessage());
                diagnostics.add(new Diagnostic(ErrorKind.PARSE_ERROR, e.getMessage(), new Location(p.toString(), 0)));
            }
        }
        return run(query, sources, diagnostics);
    }

    public QueryResponse run(FlowQuery query, List<SourceFile> sources) {
        return run(query, sources, List.of());
    }

    private QueryResponse run(FlowQuery query, List<SourceFile> sources, List<Diagnostic> readProblems) {
        QueryError invalid = validate(query);
        if (invalid != null) {
            return QueryResponse.failed(query, invalid, readProblems);
        }
        Duration limit = timeLimit != null ? timeLimit
            : Duration.ofSeconds(query.timeoutSeconds() != null ? query.timeoutSeconds() : config.getTimeoutSeconds());

        ExecutorService runner = Executors.newSingleThreadExecutor(daemon("flowtrace-query"));
        try {
            Future<QueryResponse> future = runner.submit(() -> execute(query, sources, readProblems));
            return future.get(limit.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            System.err.println("[flowtrace] Query timed out after " + describe(limit));
            return QueryResponse.failed(query,
                new QueryError(ErrorKind.TIMEOUT, "Query exceeded " + describe(limit) + " time limit"), readProblems);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineException("Interrupted while waiting for query", e);
        } catch (ExecutionException e) {
            throw new EngineException("Query failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            runner.shutdownNow();
        }
    }

    private static String describe(Duration limit) {
        return limit.toMillis() % 1000 == 0 ? limit.getSeconds() + "s" : limit.toMillis() + "ms";
    }

    private static QueryError validate(FlowQuery query) {
        if (query.mode() != AnalysisMode.SHOW_ALL && (query.variable() == null || query.variable().isBlank())) {
            return new QueryError(ErrorKind.INVALID_QUERY, "A variable name is required for mode " + query.mode().id());
        }
        if (query.maxDepth() != null && query.maxDepth() < -1) {
            return new QueryError(ErrorKind.INVALID_QUERY, "max depth must be -1 (unbounded) or >= 0");
        }
        if (query.maxCallDepth() != null && query.maxCallDepth() < -1) {
            return new QueryError(ErrorKind.INVALID_QUERY, "max call depth must be -1 (unbounded) or >= 0");
        }
        if (query.timeoutSeconds() != null && query.timeoutSeconds() <= 0) {
            return new QueryError(ErrorKind.INVALID_QUERY, "timeout must be positive");
        }
        return null;
    }

    private QueryResponse execute(FlowQuery query, List<SourceFile> sources, List<Diagnostic> readProblems)
            throws InterruptedException, ExecutionException {
        // 1. Parse and build each file independently
        List<FlowGraph> parts = buildAll(sources);

        // 2. Merge, then link calls across the whole set
        FlowGraph graph = FlowGraph.merge(parts);
        int callDepth = query.maxCallDepth() != null ? query.maxCallDepth() : config.getMaxCallDepth();
        new CallGraphLinker().link(graph, query.interProcedural(), callDepth);
        System.err.println("[flowtrace] Graph: " + graph.nodeCount() + " nodes, " + graph.edges().size()
            + " edges from " + sources.size() + " files");

        List<Diagnostic> diagnostics = new ArrayList<>(readProblems);
        diagnostics.addAll(graph.diagnostics());

        // 3. Run the requested analysis
        int depth = query.maxDepth() != null ? query.maxDepth() : config.getMaxDepth();
        String variable = query.variable();
        List<Integer> versions = variable == null ? List.of() : graph.versionsOf(variable);
        List<FlowResult> results = new ArrayList<>();
        ImpactReport impact = null;
        List<CalculationStep> calculation = null;
        List<StateReport> states = null;
        List<VariableSummary> summary = null;

        switch (query.mode()) {
            case FLOW -> {
                for (Direction d : expand(query.direction())) {
                    results.add(trace(graph, variable, versions, d, depth));
                }
            }
            case IMPACT -> {
                FlowResult forward = trace(graph, variable, versions, Direction.FORWARD, depth);
                results.add(forward);
                if (forward.found()) {
                    impact = new ImpactAnalyzer(config).analyze(graph, variable,
                        Traversal.forward(graph, versions, depth));
                }
            }
            case CALC_PATH -> {
                FlowResult backward = trace(graph, variable, versions, Direction.BACKWARD, depth);
                results.add(backward);
                if (backward.found()) {
                    calculation = new CalculationPathExtractor().extract(graph, versions.get(versions.size() - 1));
                }
            }
            case STATE -> {
                if (versions.isEmpty()) {
                    results.add(FlowResult.notFound(variable, Direction.BACKWARD));
                } else {
                    states = new TypeStateTracker().track(graph, variable);
                }
            }
            case SHOW_ALL -> summary = summarize(graph);
        }

        List<String> files = sources.stream().map(SourceFile::path).toList();
        return new QueryResponse(variable, query.mode(), files, results, impact, calculation, states, summary,
            diagnostics, null);
    }

    private List<FlowGraph> buildAll(List<SourceFile> sources) throws InterruptedException, ExecutionException {
        ExecutorService workers = Executors.newFixedThreadPool(config.getParseWorkers(), daemon("flowtrace-parse"));
        try {
            List<Callable<FlowGraph>> tasks = new ArrayList<>();
            for (SourceFile file : sources) {
                tasks.add(() -> buildOne(file));
            }
            List<FlowGraph> graphs = new ArrayList<>();
            for (Future<FlowGraph> f : workers.invokeAll(tasks)) {
                graphs.add(f.get());
            }
            return graphs;
        } finally {
            workers.shutdownNow();
        }
    }

    /**
     * Parses and builds one file. A file that breaks the parser or the builder, including one nested
     * too deeply for the stack, becomes a PARSE_ERROR diagnostic and the rest of the batch goes on.
     */
    private FlowGraph buildOne(SourceFile file) {
        try {
            return new FlowGraphBuilder(config).build(cache.parse(file));
        } catch (RuntimeException | StackOverflowError e) {
            String message = "Could not analyze " + file.path() + ": "
                + (e instanceof StackOverflowError ? "nesting too deep" : e.getMessage());
            System.err.println("[flowtrace] Warning: " + message);
            FlowGraph graph = new FlowGraph();
            graph.addFile(file.path());
            graph.addDiagnostic(new Diagnostic(ErrorKind.PARSE_ERROR, message, new Location(file.path(), 0)));
            return graph;
        }
    }

    private static List<Direction> expand(Direction direction) {
        return direction == Direction.BOTH ? List.of(Direction.FORWARD, Direction.BACKWARD) : List.of(direction);
    }

    private static FlowResult trace(FlowGraph graph, String variable, List<Integer> versions, Direction direction,
                                    int depth) {
        if (versions.isEmpty()) return FlowResult.notFound(variable, direction);
        Reachability reach = direction == Direction.FORWARD
            ? Traversal.forward(graph, versions, depth)
            : Traversal.backward(graph, versions, depth);
        return FlowResult.of(graph, variable, direction, reach);
    }

    /** Every variable name with its definition sites and direct neighbors, sorted by name. */
    static List<VariableSummary> summarize(FlowGraph graph) {
        Map<String, List<Location>> definitions = new TreeMap<>();
        Map<String, TreeSet<String>> dependsOn = new TreeMap<>();
        Map<String, TreeSet<String>> dependents = new TreeMap<>();
        for (FlowNode n : graph.nodes()) {
            if (!n.kind().isVariable()) continue;
            definitions.computeIfAbsent(n.name(), k -> new ArrayList<>()).add(n.location());
            TreeSet<String> in = dependsOn.computeIfAbsent(n.name(), k -> new TreeSet<>());
            for (FlowEdge e : graph.incoming(n.id())) {
                String from = graph.node(e.from()).name();
                if (!from.equals(n.name())) in.add(from);
            }
            TreeSet<String> out = dependents.computeIfAbsent(n.name(), k -> new TreeSet<>());
            for (FlowEdge e : graph.outgoing(n.id())) {
                String to = graph.node(e.to()).name();
                if (!to.equals(n.name())) out.add(to);
            }
        }
        List<VariableSummary> summary = new ArrayList<>();
        for (Map.Entry<String, List<Location>> e : definitions.entrySet()) {
            summary.add(new VariableSummary(e.getKey(), e.getValue(), new ArrayList<>(dependsOn.get(e.getKey())),
                new ArrayList<>(dependents.get(e.getKey()))));
        }
        return summary;
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }
}
