package com.flowtrace.engine.query;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One analysis request. {@code maxDepth}, {@code maxCallDepth} and {@code timeoutSeconds} are
 * null when the configured default applies.
 */
public record FlowQuery(
    String variable,
    List<Path> files,
    Path scope,
    boolean recursive,
    String include,
    String exclude,
    Direction direction,
    AnalysisMode mode,
    boolean interProcedural,
    Integer maxDepth,
    Integer maxCallDepth,
    Integer timeoutSeconds
) {

    public static Builder builder(String variable) {
        return new Builder(variable);
    }

    public static class Builder {
        private final String variable;
        private final List<Path> files = new ArrayList<>();
        private Path scope;
        private boolean recursive;
        private String include;
        private String exclude;
        private Direction direction = Direction.FORWARD;
        private AnalysisMode mode = AnalysisMode.FLOW;
        private boolean interProcedural;
        private Integer maxDepth;
        private Integer maxCallDepth;
        private Integer timeoutSeconds;

        Builder(String variable) {
            this.variable = variable;
        }

        public Builder file(Path file)                 { files.add(file); return this; }
        public Builder scope(Path dir)                 { this.scope = dir; return this; }
        public Builder recursive(boolean value)        { this.recursive = value; return this; }
        public Builder include(String glob)            { this.include = glob; return this; }
        public Builder exclude(String glob)            { this.exclude = glob; return this; }
        public Builder direction(Direction value)      { this.direction = value; return this; }
        public Builder mode(AnalysisMode value)        { this.mode = value; return this; }
        public Builder interProcedural(boolean value)  { this.interProcedural = value; return this; }
        public Builder maxDepth(Integer value)         { this.maxDepth = value; return this; }
        public Builder maxCallDepth(Integer value)     { this.maxCallDepth = value; return this; }
        public Builder timeoutSeconds(Integer value)   { this.timeoutSeconds = value; return this; }

        public FlowQuery build() {
            return new FlowQuery(variable, List.copyOf(files), scope, recursive, include, exclude, direction, mode,
                interProcedural, maxDepth, maxCallDepth, timeoutSeconds);
        }
    }
}
