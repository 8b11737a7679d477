package com.flowtrace.engine;

import com.flowtrace.engine.config.EngineConfig;
import com.flowtrace.engine.config.EngineConfigReader;
import com.flowtrace.engine.query.AnalysisMode;
import com.flowtrace.engine.query.Direction;
import com.flowtrace.engine.query.FlowEngine;
import com.flowtrace.engine.query.FlowQuery;
import com.flowtrace.engine.query.QueryResponse;
import com.flowtrace.engine.render.DotRenderer;
import com.flowtrace.engine.render.JsonRenderer;
import com.flowtrace.engine.render.OutputFormat;
import com.flowtrace.engine.render.TextRenderer;

import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Entry point for the flowtrace command line.
 *
 * Usage:
 *   java -jar flowtrace-engine-java.jar trace \
 *     --var <name> (--file <path>... | --scope <dir> [--recursive]) \
 *     [--direction forward|backward|both] [--mode flow|impact|calc-path|state|show-all] \
 *     [--inter-procedural] [--max-depth N] [--max-call-depth N] [--format text|json|graph] \
 *     [--include <glob>] [--exclude <glob>] [--config <file>] [--timeout <seconds>] [--affected-lines]
 *
 * The rendered result goes to stdout; progress and warnings go to stderr.
 */
public class FlowTraceMain {

    public static void main(String[] args) {
        try {
            print(run(args), System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[flowtrace] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar flowtrace-engine-java.jar trace --var <name> "
                               + "(--file <path>... | --scope <dir>) [options]");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[flowtrace] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Writes rendered output as UTF-8 whatever the platform charset is; paths are drawn with arrows. */
    static void print(String rendered, OutputStream target) {
        PrintStream out = new PrintStream(target, true, StandardCharsets.UTF_8);
        out.print(rendered);
        out.flush();
    }

    /** Runs one command and returns the rendered output. */
    static String run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("trace")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        // Parse flags
        String variable = null;
        String configPath = null;
        String direction = "forward";
        String mode = "flow";
        String format = "text";
        String maxDepth = null;
        String maxCallDepth = null;
        String timeout = null;
        boolean affectedLines = false;
        List<String> files = new ArrayList<>();
        String scope = null;
        String include = null;
        String exclude = null;
        boolean recursive = false;
        boolean interProcedural = false;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--var"              -> variable     = requireNext(args, i++, "--var");
                case "--file"             -> files.add(requireNext(args, i++, "--file"));
                case "--scope"            -> scope        = requireNext(args, i++, "--scope");
                case "--include"          -> include      = requireNext(args, i++, "--include");
                case "--exclude"          -> exclude      = requireNext(args, i++, "--exclude");
                case "--direction"        -> direction    = requireNext(args, i++, "--direction");
                case "--mode"             -> mode         = requireNext(args, i++, "--mode");
                case "--format"           -> format       = requireNext(args, i++, "--format");
                case "--max-depth"        -> maxDepth     = requireNext(args, i++, "--max-depth");
                case "--max-call-depth"   -> maxCallDepth = requireNext(args, i++, "--max-call-depth");
                case "--timeout"          -> timeout      = requireNext(args, i++, "--timeout");
                case "--config"           -> configPath   = requireNext(args, i++, "--config");
                case "--recursive"        -> recursive = true;
                case "--inter-procedural" -> interProcedural = true;
                case "--affected-lines"   -> affectedLines = true;
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        AnalysisMode analysisMode = parse(mode, AnalysisMode::parse);
        if (variable == null && analysisMode != AnalysisMode.SHOW_ALL) {
            throw new UsageException("--var is required");
        }
        if (files.isEmpty() && scope == null) {
            throw new UsageException("--file or --scope is required");
        }

        FlowQuery.Builder builder = FlowQuery.builder(variable)
            .direction(parse(direction, Direction::parse))
            .mode(analysisMode)
            .interProcedural(interProcedural)
            .recursive(recursive)
            .include(include)
            .exclude(exclude)
            .maxDepth(integer(maxDepth, "--max-depth"))
            .maxCallDepth(integer(maxCallDepth, "--max-call-depth"))
            .timeoutSeconds(integer(timeout, "--timeout"));
        for (String f : files) builder.file(Paths.get(f));
        if (scope != null) builder.scope(Paths.get(scope));
        OutputFormat outputFormat = parse(format, OutputFormat::parse);

        // 1. Configuration
        EngineConfigReader reader = new EngineConfigReader();
        EngineConfig config = configPath != null ? reader.read(Paths.get(configPath)) : reader.defaults();

        // 2. Query
        QueryResponse response = new FlowEngine(config).run(builder.build());
        if (response.error() != null) {
            System.err.println("[flowtrace] Query failed: " + response.error().message());
        }

        // 3. Render
        return switch (outputFormat) {
            case TEXT  -> new TextRenderer(affectedLines).render(response);
            case JSON  -> new JsonRenderer().render(response) + "\n";
            case GRAPH -> new DotRenderer().render(response);
        };
    }

    private static <T> T parse(String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
    }

    private static Integer integer(String value, String flag) {
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(flag + " expects an integer, got: " + value);
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
