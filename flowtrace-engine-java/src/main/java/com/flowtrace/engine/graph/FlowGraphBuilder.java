package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Expr;
import com.flowtrace.engine.ast.ExprPrinter;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.ast.Origin;
import com.flowtrace.engine.ast.ParseError;
import com.flowtrace.engine.ast.ParseResult;
import com.flowtrace.engine.ast.Stmt;
import com.flowtrace.engine.ast.Target;
import com.flowtrace.engine.config.EngineConfig;
import com.flowtrace.engine.source.Language;
import com.flowtrace.engine.source.SourceFile;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the dependency graph of one parsed file.
 *
 * Statements are walked in source order. Every write creates a new version node; every read
 * resolves to the most recent visible version (innermost scope first) and becomes an edge into
 * the version being written. Calls are recorded as {@link CallSite}s and left for the linker.
 * The result depends only on the parse result and the configuration.
 */
public class FlowGraphBuilder {

    private final EngineConfig config;

    public FlowGraphBuilder(EngineConfig config) {
        this.config = config;
    }

    /**
     * A failed parse gives a graph with no nodes and the parse errors as diagnostics; callers
     * check {@link FlowGraph#hasParseErrors()}.
     */
    public FlowGraph build(ParseResult parsed) {
        FlowGraph graph = new FlowGraph();
        graph.addFile(parsed.file().path());
        if (!parsed.ok()) {
            for (ParseError e : parsed.errors()) {
                System.err.println("[flowtrace] Warning: skipping " + e);
                graph.addDiagnostic(new Diagnostic(ErrorKind.PARSE_ERROR, e.message(), new Location(e.file(), e.line())));
            }
            return graph;
        }
        new FileBuild(graph, parsed.file()).run(parsed.statements());
        return graph;
    }

    /** Lexical scope during the walk. */
    private static final class Frame {
        final int scopeId;
        final ScopeKind kind;
        final Frame parent;
        final String simpleName;
        final String qualifiedName;
        final String className;
        final Map<String, Integer> latest = new HashMap<>();
        final Set<String> globals = new HashSet<>();
        final Set<String> nonlocals = new HashSet<>();
        final Set<String> definitions = new HashSet<>();
        int returnNode = -1;

        Frame(int scopeId, ScopeKind kind, Frame parent, String simpleName, String qualifiedName, String className) {
            this.scopeId = scopeId;
            this.kind = kind;
            this.parent = parent;
            this.simpleName = simpleName;
            this.qualifiedName = qualifiedName;
            this.className = className;
        }
    }

    /** Nodes an expression reads, plus field reads that can only be resolved once the class is complete. */
    private static final class Deps {
        final Set<Integer> nodes = new LinkedHashSet<>();
        final List<PendingField> fields = new ArrayList<>();
        PendingCall call;
    }

    private record PendingField(String className, String key, List<Integer> fallback) {}

    private record PendingRead(PendingField field, int target, EdgeKind kind, Location location) {}

    private record PendingCall(int callerScopeId, String calleeName, String calleeText, CallSite.Receiver receiver,
                               String receiverText, boolean construction, List<CallSite.Argument> args,
                               List<CallSite.Argument> keywords, List<Integer> receiverSources, Origin origin) {}

    private final class FileBuild implements Stmt.Visitor<Void> {

        private final FlowGraph graph;
        private final SourceFile file;
        private final Language language;
        private final TypeInference types;
        private final Map<String, Integer> externals = new LinkedHashMap<>();
        private final Map<String, Map<String, Integer>> classFields = new HashMap<>();
        private final List<PendingRead> pendingReads = new ArrayList<>();
        private Frame module;
        private Frame current;
        private boolean declaring;

        FileBuild(FlowGraph graph, SourceFile file) {
            this.graph = graph;
            this.file = file;
            this.language = file.language();
            this.types = new TypeInference(language, this::visibleType);
        }

        void run(List<Stmt> statements) {
            Location start = new Location(file.path(), 1);
            int scopeId = graph.addScope(new Scope(-1, "<module>", "<module>", ScopeKind.MODULE, -1, file.path(), null,
                List.of(), List.of(), -1, start));
            module = new Frame(scopeId, ScopeKind.MODULE, null, "<module>", "<module>", null);
            current = module;
            walk(statements);
            resolvePending(null);
        }

        private void walk(List<Stmt> statements) {
            for (Stmt s : statements) s.accept(this);
        }

        // ---- statements ----

        @Override
        public Void visitAssign(Stmt.Assign s) {
            Origin o = s.origin();
            declaring = language == Language.JAVA && s.declaredType() != null;
            try {
                assign(s, o);
            } finally {
                declaring = false;
            }
            return null;
        }

        private void assign(Stmt.Assign s, Origin o) {
            if (s.value() == null) {
                InferredType declared = types.declared(s.declaredType());
                for (Target t : s.targets()) bind(t, new Deps(), declared, "", o, EdgeKind.ASSIGNMENT, new ArrayList<>());
                return;
            }
            boolean elementBinding = s.form() == Stmt.AssignForm.LOOP_ELEMENT || s.form() == Stmt.AssignForm.CONTEXT_BINDING;
            List<Integer> written = new ArrayList<>();
            if (!elementBinding && pairsElementwise(s.targets(), s.value())) {
                List<Expr> values = ((Expr.Container) s.value()).elements();
                List<Deps> valueDeps = new ArrayList<>();
                List<InferredType> valueTypes = new ArrayList<>();
                for (Expr v : values) {
                    valueDeps.add(collectValue(v, o));
                    valueTypes.add(types.infer(v));
                }
                for (Target t : s.targets()) {
                    List<Target> elements = ((Target.TupleTarget) t).elements();
                    for (int i = 0; i < elements.size(); i++) {
                        List<Integer> one = new ArrayList<>();
                        bind(elements.get(i), valueDeps.get(i), valueTypes.get(i), ExprPrinter.print(values.get(i)), o,
                            EdgeKind.ASSIGNMENT, one);
                        written.addAll(one);
                        if (valueDeps.get(i).call != null) finishCall(valueDeps.get(i).call, one);
                    }
                }
                return;
            }
            Deps deps = collectValue(s.value(), o);
            InferredType type = elementBinding ? types.declared(s.declaredType()) : types.infer(s.value(), s.declaredType());
            String expression = ExprPrinter.print(s.value());
            for (Target t : s.targets()) {
                bind(t, deps, t instanceof Target.TupleTarget ? InferredType.UNKNOWN : type, expression, o,
                    EdgeKind.ASSIGNMENT, written);
            }
            if (deps.call != null) finishCall(deps.call, written);
        }

        private boolean pairsElementwise(List<Target> targets, Expr value) {
            if (!(value instanceof Expr.Container c)) return false;
            if (c.kind() != Expr.ContainerKind.TUPLE && c.kind() != Expr.ContainerKind.LIST) return false;
            if (c.elements().stream().anyMatch(e -> e instanceof Expr.Unary u && u.op().equals("*"))) return false;
            for (Target t : targets) {
                if (!(t instanceof Target.TupleTarget tuple) || tuple.elements().size() != c.elements().size()) return false;
            }
            return true;
        }

        @Override
        public Void visitAugAssign(Stmt.AugAssign s) {
            Origin o = s.origin();
            Deps deps = collectValue(s.value(), o);
            String expression = ExprPrinter.print(s.target()) + " " + s.op() + "= " + ExprPrinter.print(s.value());
            int written;
            int previous;
            Target target = s.target();
            if (target instanceof Target.NameTarget n) {
                Integer prev = resolveName(n.name());
                previous = prev != null ? prev : external(n.name(), o);
                InferredType type = types.infer(new Expr.Binary(s.op(), new Expr.Name(n.name()), s.value()));
                written = defineName(n.name(), type, expression, o, false);
            } else if (target instanceof Target.AttributeTarget a) {
                previous = attributeVersion(a.base(), a.name());
                InferredType type = previous >= 0 ? graph.node(previous).type() : InferredType.UNKNOWN;
                written = writeAttribute(a.base(), a.name(), type, expression, o, false);
            } else if (target instanceof Target.SubscriptTarget sub) {
                previous = -1;
                written = mutate(sub.base(), expression, o);
                Deps index = collect(sub.index(), o);
                if (written >= 0) connect(index, written, EdgeKind.AUGMENTED, o.location());
            } else {
                unsupported("augmented assignment to " + ExprPrinter.print(target), o);
                return null;
            }
            if (written < 0) {
                if (deps.call != null) finishCall(deps.call, List.of());
                return null;
            }
            if (previous >= 0) graph.addEdge(previous, written, EdgeKind.AUGMENTED, o.location());
            connect(deps, written, EdgeKind.AUGMENTED, o.location());
            if (deps.call != null) finishCall(deps.call, List.of(written));
            return null;
        }

        @Override
        public Void visitExpression(Stmt.ExprStmt s) {
            Deps deps = collectValue(s.expr(), s.origin());
            if (deps.call != null) finishCall(deps.call, List.of());
            return null;
        }

        @Override
        public Void visitReturn(Stmt.Return s) {
            if (s.value() == null) return null;
            Frame function = enclosingFunction();
            if (function == null) {
                unsupported("return outside a function", s.origin());
                return null;
            }
            Deps deps = collectValue(s.value(), s.origin());
            if (function.returnNode < 0) {
                function.returnNode = graph.addNode(new FlowNode(-1, function.simpleName + ".return", NodeKind.RETURN,
                    function.scopeId, s.origin().location(), s.origin().code(), ExprPrinter.print(s.value()),
                    types.infer(s.value()), s.origin().context(), false, null));
                graph.updateScope(graph.scope(function.scopeId).withReturnNode(function.returnNode));
            }
            connect(deps, function.returnNode, EdgeKind.ASSIGNMENT, s.origin().location());
            if (deps.call != null) finishCall(deps.call, List.of(function.returnNode));
            return null;
        }

        @Override
        public Void visitFunction(Stmt.FunctionDef s) {
            Frame parent = current;
            parent.definitions.add(s.name());
            String className = parent.kind == ScopeKind.CLASS ? parent.simpleName : parent.className;
            String qualified = parent.kind == ScopeKind.MODULE ? s.name() : parent.qualifiedName + "." + s.name();
            List<String> paramNames = s.params().stream().map(Stmt.Param::name).toList();
            int scopeId = graph.addScope(new Scope(-1, qualified, s.name(), ScopeKind.FUNCTION, parent.scopeId,
                file.path(), className, paramNames, List.of(), -1, s.origin().location()));

            Frame frame = new Frame(scopeId, ScopeKind.FUNCTION, parent, s.name(), qualified, className);
            current = frame;
            List<Integer> paramIds = new ArrayList<>();
            for (Stmt.Param p : s.params()) {
                int id = graph.addNode(new FlowNode(-1, p.name(), NodeKind.PARAMETER, scopeId, p.location(),
                    file.line(p.location().line()), "parameter of " + qualified, types.declared(p.declaredType()),
                    ControlContext.TOP, false, null));
                frame.latest.put(p.name(), id);
                paramIds.add(id);
            }
            graph.updateScope(graph.scope(scopeId).withParams(paramIds));
            walk(s.body());
            current = parent;
            return null;
        }

        @Override
        public Void visitClass(Stmt.ClassDef s) {
            Frame parent = current;
            parent.definitions.add(s.name());
            String qualified = parent.kind == ScopeKind.MODULE ? s.name() : parent.qualifiedName + "." + s.name();
            int scopeId = graph.addScope(new Scope(-1, qualified, s.name(), ScopeKind.CLASS, parent.scopeId,
                file.path(), s.name(), List.of(), List.of(), -1, s.origin().location()));
            classFields.computeIfAbsent(s.name(), k -> new HashMap<>());
            current = new Frame(scopeId, ScopeKind.CLASS, parent, s.name(), qualified, s.name());
            walk(s.body());
            current = parent;
            resolvePending(s.name());
            return null;
        }

        @Override
        public Void visitGlobal(Stmt.GlobalDecl s) {
            (s.outer() ? current.nonlocals : current.globals).addAll(s.names());
            return null;
        }

        @Override
        public Void visitUnsupported(Stmt.Unsupported s) {
            unsupported("'" + s.construct() + "' statement skipped", s.origin());
            return null;
        }

        // ---- writes ----

        /** Binds one target to a value; created nodes are appended to {@code written}. */
        private void bind(Target target, Deps deps, InferredType type, String expression, Origin o,
                          EdgeKind kind, List<Integer> written) {
            if (target instanceof Target.NameTarget n) {
                int id = defineName(n.name(), type, expression, o, false);
                connect(deps, id, kind, o.location());
                written.add(id);
            } else if (target instanceof Target.AttributeTarget a) {
                int id = writeAttribute(a.base(), a.name(), type, expression, o, false);
                connect(deps, id, EdgeKind.ATTRIBUTE_WRITE, o.location());
                written.add(id);
            } else if (target instanceof Target.SubscriptTarget s) {
                int id = mutate(s.base(), ExprPrinter.print(target) + " = " + expression, o);
                if (id < 0) return;
                connect(collect(s.index(), o), id, kind, o.location());
                connect(deps, id, kind, o.location());
                written.add(id);
            } else if (target instanceof Target.TupleTarget t) {
                for (Target element : t.elements()) bind(element, deps, InferredType.UNKNOWN, expression, o, kind, written);
            }
        }

        /** New version of a plain name, placed in the scope the language's binding rules pick. */
        private int defineName(String name, InferredType type, String expression, Origin o, boolean mutation) {
            Frame owner = current;
            NodeKind kind = NodeKind.LOCAL;
            String fieldClass = null;
            String fieldKey = null;

            if (current.kind == ScopeKind.CLASS) {
                kind = NodeKind.FIELD;
                fieldClass = current.className;
                fieldKey = fieldKey(name);
            } else if (language == Language.PYTHON && current.kind == ScopeKind.FUNCTION && current.globals.contains(name)) {
                owner = module;
                kind = NodeKind.GLOBAL;
            } else if (language == Language.PYTHON && current.nonlocals.contains(name)) {
                owner = enclosingOwner(current.parent, name);
            } else if (language == Language.JAVA && current.kind == ScopeKind.FUNCTION) {
                Frame local = declaring ? current : functionFrameDefining(name);
                if (local == null && current.className != null && fieldVersion(current.className, name) != null) {
                    kind = NodeKind.FIELD;
                    fieldClass = current.className;
                    fieldKey = name;
                } else if (local != null) {
                    owner = local;
                }
            }

            String nodeName = fieldKey != null ? fieldKey : name;
            int id = graph.addNode(new FlowNode(-1, nodeName, kind, current.scopeId, o.location(), o.code(), expression,
                type, o.context(), mutation, null));
            if (fieldClass != null) {
                classFields.computeIfAbsent(fieldClass, k -> new HashMap<>()).put(fieldKey, id);
                if (current.kind == ScopeKind.CLASS) current.latest.put(name, id);
            } else {
                owner.latest.put(name, id);
            }
            return id;
        }

        /** Write to {@code base.attr}: a class field for self/this, otherwise a dotted field of the current scope. */
        private int writeAttribute(Expr base, String attr, InferredType type, String expression, Origin o, boolean mutation) {
            String cls = current.className;
            if (isSelf(base) && cls != null) {
                String key = fieldKey(attr);
                int id = graph.addNode(new FlowNode(-1, key, NodeKind.FIELD, current.scopeId, o.location(), o.code(),
                    expression, type, o.context(), mutation, null));
                classFields.computeIfAbsent(cls, k -> new HashMap<>()).put(key, id);
                return id;
            }
            String dotted = ExprPrinter.print(base) + "." + attr;
            int id = graph.addNode(new FlowNode(-1, dotted, NodeKind.FIELD, current.scopeId, o.location(), o.code(),
                expression, type, o.context(), mutation, null));
            current.latest.put(dotted, id);
            return id;
        }

        /**
         * In-place change of the container held by {@code receiver}: a new version of its root
         * variable, fed by the previous one. Returns -1 when the root cannot be named.
         */
        private int mutate(Expr receiver, String expression, Origin o) {
            Expr root = receiver;
            while (root instanceof Expr.Subscript s) root = s.base();

            if (root instanceof Expr.Name n) {
                Integer prev = resolveName(n.id());
                if (prev == null) {
                    if (language == Language.JAVA && n.id().equals("this")) return -1;
                    prev = external(n.id(), o);
                }
                FlowNode previous = graph.node(prev);
                Frame owner = ownerOf(n.id(), prev);
                NodeKind kind = previous.kind() == NodeKind.FIELD ? NodeKind.FIELD
                    : (owner == module && current != module && enclosingFunction() != null) ? NodeKind.GLOBAL
                    : NodeKind.LOCAL;
                int id = graph.addNode(new FlowNode(-1, previous.name(), kind, current.scopeId, o.location(), o.code(),
                    expression, previous.type(), o.context(), true, null));
                if (previous.kind() == NodeKind.FIELD && current.className != null
                        && classFields.getOrDefault(current.className, Map.of()).get(previous.name()) != null) {
                    classFields.get(current.className).put(previous.name(), id);
                } else if (owner != null) {
                    owner.latest.put(n.id(), id);
                } else {
                    current.latest.put(n.id(), id);
                }
                graph.addEdge(prev, id, EdgeKind.AUGMENTED, o.location());
                return id;
            }
            if (root instanceof Expr.Attribute a) {
                int prev = attributeVersion(a.base(), a.name());
                InferredType type = prev >= 0 ? graph.node(prev).type() : InferredType.UNKNOWN;
                int id = writeAttribute(a.base(), a.name(), type, expression, o, true);
                if (prev >= 0) graph.addEdge(prev, id, EdgeKind.AUGMENTED, o.location());
                return id;
            }
            return -1;
        }

        // ---- reads ----

        private Deps collect(Expr e, Origin o) {
            Deps deps = new Deps();
            if (e != null) e.accept(new Collector(deps, o, Set.of()));
            return deps;
        }

        /** Like {@link #collect}, but a call forming the whole value is left open for its targets. */
        private Deps collectValue(Expr e, Origin o) {
            if (e instanceof Expr.Call c) {
                Deps deps = new Deps();
                deps.call = startCall(c.callee(), c.args(), c.keywords(), false, o);
                return deps;
            }
            if (e instanceof Expr.New n) {
                Deps deps = new Deps();
                deps.call = startCall(new Expr.Name(n.type()), n.args(), List.of(), true, o);
                return deps;
            }
            return collect(e, o);
        }

        private final class Collector implements Expr.Visitor<Void> {
            private final Deps out;
            private final Origin origin;
            private final Set<String> bound;

            Collector(Deps out, Origin origin, Set<String> bound) {
                this.out = out;
                this.origin = origin;
                this.bound = bound;
            }

            @Override
            public Void visitName(Expr.Name e) {
                if (bound.contains(e.id())) return null;
                Integer v = resolveName(e.id());
                if (v != null) {
                    out.nodes.add(v);
                } else if (!isDefinition(e.id()) && !(language == Language.JAVA && e.id().equals("this"))) {
                    out.nodes.add(external(e.id(), origin));
                }
                return null;
            }

            @Override
            public Void visitLiteral(Expr.Literal e) {
                return null;
            }

            @Override
            public Void visitAttribute(Expr.Attribute e) {
                String cls = current.className;
                if (isSelf(e.base()) && cls != null) {
                    String key = fieldKey(e.name());
                    Integer v = fieldVersion(cls, key);
                    if (v != null) {
                        out.nodes.add(v);
                    } else {
                        Deps base = new Deps();
                        e.base().accept(new Collector(base, origin, bound));
                        out.fields.add(new PendingField(cls, key, new ArrayList<>(base.nodes)));
                    }
                    return null;
                }
                if (e.base() instanceof Expr.Name n && !bound.contains(n.id())) {
                    Integer v = resolveName(n.id() + "." + e.name());
                    if (v != null) {
                        out.nodes.add(v);
                        return null;
                    }
                }
                return e.base().accept(this);
            }

            @Override
            public Void visitSubscript(Expr.Subscript e) {
                e.base().accept(this);
                return e.index().accept(this);
            }

            @Override
            public Void visitBinary(Expr.Binary e) {
                // left-deep operator chains are walked without recursion
                Deque<Expr> rights = new ArrayDeque<>();
                Expr left = e;
                while (left instanceof Expr.Binary b) {
                    rights.push(b.right());
                    left = b.left();
                }
                left.accept(this);
                while (!rights.isEmpty()) rights.pop().accept(this);
                return null;
            }

            @Override
            public Void visitUnary(Expr.Unary e) {
                return e.operand().accept(this);
            }

            @Override
            public Void visitConditional(Expr.Conditional e) {
                e.test().accept(this);
                e.whenTrue().accept(this);
                return e.whenFalse().accept(this);
            }

            @Override
            public Void visitContainer(Expr.Container e) {
                for (Expr element : e.elements()) element.accept(this);
                return null;
            }

            @Override
            public Void visitCall(Expr.Call e) {
                PendingCall call = startCall(e.callee(), e.args(), e.keywords(), false, origin);
                out.nodes.add(callResult(call, e, origin));
                return null;
            }

            @Override
            public Void visitNew(Expr.New e) {
                PendingCall call = startCall(new Expr.Name(e.type()), e.args(), List.of(), true, origin);
                out.nodes.add(callResult(call, e, origin));
                return null;
            }

            @Override
            public Void visitCast(Expr.Cast e) {
                return e.operand().accept(this);
            }

            @Override
            public Void visitComprehension(Expr.Comprehension e) {
                if (!e.iterables().isEmpty()) e.iterables().get(0).accept(this);
                Set<String> inner = new HashSet<>(bound);
                inner.addAll(e.loopVars());
                Collector scoped = new Collector(out, origin, inner);
                for (int i = 1; i < e.iterables().size(); i++) e.iterables().get(i).accept(scoped);
                for (Expr r : e.results()) r.accept(scoped);
                for (Expr c : e.conditions()) c.accept(scoped);
                return null;
            }

            @Override
            public Void visitFormattedString(Expr.FormattedString e) {
                for (Expr part : e.parts()) part.accept(this);
                return null;
            }

            @Override
            public Void visitUnsupported(Expr.Unsupported e) {
                unsupported("'" + e.construct() + "' expression not modeled", origin);
                for (Expr operand : e.operands()) operand.accept(this);
                return null;
            }
        }

        /** Latest visible version of a name, or null. */
        private Integer resolveName(String name) {
            if (current.kind == ScopeKind.FUNCTION && current.globals.contains(name)) {
                return module.latest.get(name);
            }
            for (Frame f = current; f != null; f = f.parent) {
                if (f.kind == ScopeKind.CLASS && f != current) {
                    if (language == Language.JAVA) {
                        Integer field = fieldVersion(f.className, name);
                        if (field != null) return field;
                    }
                    continue;
                }
                Integer v = f.latest.get(name);
                if (v != null) return v;
            }
            return null;
        }

        private boolean isDefinition(String name) {
            for (Frame f = current; f != null; f = f.parent) {
                if (f.definitions.contains(name)) return true;
            }
            return false;
        }

        private int attributeVersion(Expr base, String attr) {
            if (isSelf(base) && current.className != null) {
                Integer v = fieldVersion(current.className, fieldKey(attr));
                return v != null ? v : -1;
            }
            Integer v = resolveName(ExprPrinter.print(base) + "." + attr);
            return v != null ? v : -1;
        }

        private Integer fieldVersion(String className, String key) {
            Map<String, Integer> fields = classFields.get(className);
            return fields == null ? null : fields.get(key);
        }

        private String fieldKey(String attr) {
            return language == Language.PYTHON ? "self." + attr : attr;
        }

        private boolean isSelf(Expr base) {
            return base instanceof Expr.Name n
                && (language == Language.PYTHON ? n.id().equals("self") : n.id().equals("this"));
        }

        private int external(String name, Origin o) {
            return externals.computeIfAbsent(name, n -> {
                graph.addDiagnostic(new Diagnostic(ErrorKind.UNRESOLVED_REFERENCE,
                    "unresolved name '" + n + "' treated as external input", o.location()));
                return graph.addNode(new FlowNode(-1, n, NodeKind.EXTERNAL, module.scopeId, o.location(), o.code(), "",
                    InferredType.UNKNOWN, ControlContext.TOP, false, null));
            });
        }

        // ---- calls ----

        private PendingCall startCall(Expr callee, List<Expr> args, List<Expr.Keyword> keywords,
                                      boolean construction, Origin o) {
            Expr.Call shape = new Expr.Call(callee, args, keywords, o.line());
            String calleeName = shape.calleeName();
            Expr receiverExpr = shape.receiver();
            CallSite.Receiver receiver = receiverExpr == null ? CallSite.Receiver.NONE
                : isSelf(receiverExpr) ? CallSite.Receiver.SELF : CallSite.Receiver.OTHER;
            List<Integer> receiverSources = receiverExpr == null ? List.of() : sourcesOf(collect(receiverExpr, o));

            List<CallSite.Argument> argList = new ArrayList<>();
            for (Expr a : args) {
                boolean starred = a instanceof Expr.Unary u && u.op().equals("*");
                Expr value = starred ? ((Expr.Unary) a).operand() : a;
                argList.add(new CallSite.Argument(null, ExprPrinter.print(a), value instanceof Expr.Literal, starred,
                    sourcesOf(collect(value, o))));
            }
            List<CallSite.Argument> keywordList = new ArrayList<>();
            for (Expr.Keyword k : keywords) {
                keywordList.add(new CallSite.Argument(k.name(), ExprPrinter.print(k.value()),
                    k.value() instanceof Expr.Literal, k.name() == null, sourcesOf(collect(k.value(), o))));
            }

            if (receiverExpr != null && !construction && config.isMutatingMethod(calleeName)) {
                int mutated = mutate(receiverExpr, ExprPrinter.print(shape), o);
                if (mutated >= 0) {
                    for (CallSite.Argument a : argList) addEdges(a.sources(), mutated, EdgeKind.CALL_ARGUMENT, o);
                    for (CallSite.Argument a : keywordList) addEdges(a.sources(), mutated, EdgeKind.CALL_ARGUMENT, o);
                }
            }
            Optional<String> category = construction ? Optional.empty() : config.sideEffectCategory(calleeName);
            if (category.isPresent()) {
                int sink = graph.addNode(new FlowNode(-1, ExprPrinter.print(callee) + "()", NodeKind.SINK,
                    current.scopeId, o.location(), o.code(), ExprPrinter.print(shape), InferredType.UNKNOWN,
                    o.context(), false, category.get()));
                for (CallSite.Argument a : argList) addEdges(a.sources(), sink, EdgeKind.CALL_ARGUMENT, o);
                for (CallSite.Argument a : keywordList) addEdges(a.sources(), sink, EdgeKind.CALL_ARGUMENT, o);
            }
            return new PendingCall(current.scopeId, calleeName, ExprPrinter.print(callee), receiver,
                receiverExpr == null ? null : ExprPrinter.print(receiverExpr), construction, argList, keywordList,
                receiverSources, o);
        }

        /** Synthetic node standing for the value of a call nested in a larger expression. */
        private int callResult(PendingCall call, Expr e, Origin o) {
            int id = graph.addNode(new FlowNode(-1, call.calleeText() + "()", NodeKind.CALL_RESULT, current.scopeId,
                o.location(), o.code(), ExprPrinter.print(e), types.infer(e), o.context(), false, null));
            finishCall(call, List.of(id));
            return id;
        }

        private void finishCall(PendingCall call, List<Integer> results) {
            Origin o = call.origin();
            graph.addCallSite(new CallSite(-1, call.callerScopeId(), call.calleeName(), call.calleeText(),
                call.receiver(), call.receiverText(), call.construction(), call.args(), call.keywords(),
                call.receiverSources(), List.copyOf(results), o.location(), o.code(), o.context()));
        }

        // ---- helpers ----

        private void connect(Deps deps, int target, EdgeKind kind, Location location) {
            for (int n : deps.nodes) graph.addEdge(n, target, kind, location);
            for (PendingField f : deps.fields) pendingReads.add(new PendingRead(f, target, kind, location));
        }

        private void addEdges(List<Integer> sources, int target, EdgeKind kind, Origin o) {
            for (int n : sources) graph.addEdge(n, target, kind, o.location());
        }

        private List<Integer> sourcesOf(Deps deps) {
            List<Integer> sources = new ArrayList<>(deps.nodes);
            for (PendingField f : deps.fields) {
                Integer v = fieldVersion(f.className(), f.key());
                if (v != null) sources.add(v);
                else sources.addAll(f.fallback());
            }
            return sources;
        }

        /** Field reads seen before any write of the field: connect them to its final version once the class is done. */
        private void resolvePending(String className) {
            List<PendingRead> remaining = new ArrayList<>();
            for (PendingRead r : pendingReads) {
                if (className != null && !r.field().className().equals(className)) {
                    remaining.add(r);
                    continue;
                }
                Integer v = fieldVersion(r.field().className(), r.field().key());
                if (v != null) {
                    graph.addEdge(v, r.target(), r.kind(), r.location());
                } else {
                    for (int n : r.field().fallback()) graph.addEdge(n, r.target(), r.kind(), r.location());
                }
            }
            pendingReads.clear();
            pendingReads.addAll(remaining);
        }

        private Frame enclosingFunction() {
            for (Frame f = current; f != null; f = f.parent) {
                if (f.kind == ScopeKind.FUNCTION) return f;
                if (f.kind == ScopeKind.CLASS) return null;
            }
            return null;
        }

        /** Nearest enclosing function frame holding {@code name} ({@code nonlocal} target). */
        private Frame enclosingOwner(Frame from, String name) {
            for (Frame f = from; f != null && f.kind == ScopeKind.FUNCTION; f = f.parent) {
                if (f.latest.containsKey(name)) return f;
            }
            return current;
        }

        /** Function frame (current or enclosing, below the class) that already has {@code name}. */
        private Frame functionFrameDefining(String name) {
            for (Frame f = current; f != null && f.kind == ScopeKind.FUNCTION; f = f.parent) {
                if (f.latest.containsKey(name)) return f;
            }
            return null;
        }

        private Frame ownerOf(String name, int version) {
            for (Frame f = current; f != null; f = f.parent) {
                Integer v = f.latest.get(name);
                if (v != null && v == version) return f;
            }
            return null;
        }

        private InferredType visibleType(String name) {
            Integer v = resolveName(name);
            return v == null ? InferredType.UNKNOWN : graph.node(v).type();
        }

        private void unsupported(String message, Origin o) {
            graph.addDiagnostic(new Diagnostic(ErrorKind.UNSUPPORTED_CONSTRUCT, message, o.location()));
        }
    }
}
