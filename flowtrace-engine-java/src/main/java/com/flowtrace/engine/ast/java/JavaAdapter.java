package com.flowtrace.engine.ast.java;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Expr;
import com.flowtrace.engine.ast.Expr.ContainerKind;
import com.flowtrace.engine.ast.Expr.LiteralKind;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.ast.Origin;
import com.flowtrace.engine.ast.ParseError;
import com.flowtrace.engine.ast.ParseResult;
import com.flowtrace.engine.ast.SourceAdapter;
import com.flowtrace.engine.ast.Stmt;
import com.flowtrace.engine.ast.Stmt.AssignForm;
import com.flowtrace.engine.ast.Target;
import com.flowtrace.engine.source.Language;
import com.flowtrace.engine.source.SourceFile;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.ArrayCreationLevel;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.*;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Front end for Java sources, built on JavaParser.
 *
 * Each type becomes a class statement whose body lists field declarations first and then its
 * methods; constructors are named {@code <init>}. Method bodies are flattened the same way as the
 * Python front end: nested blocks are inlined with a deeper control context. Assignments nested in
 * expressions ({@code (line = r.readLine()) != null}, {@code a[i++]}) are hoisted in front of the
 * statement that contains them.
 */
public class JavaAdapter implements SourceAdapter {

    @Override
    public Language language() {
        return Language.JAVA;
    }

    @Override
    public ParseResult parse(SourceFile file) {
        JavaParser parser = new JavaParser(
            new ParserConfiguration().setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        com.github.javaparser.ParseResult<CompilationUnit> parsed = parser.parse(file.text());
        if (!parsed.isSuccessful() || parsed.getResult().isEmpty()) {
            List<ParseError> errors = new ArrayList<>();
            for (Problem problem : parsed.getProblems()) {
                int line = problem.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.line)
                    .orElse(1);
                int column = problem.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin.column)
                    .orElse(1);
                errors.add(new ParseError(file.path(), line, column, problem.getMessage()));
            }
            if (errors.isEmpty()) {
                errors.add(new ParseError(file.path(), 1, 1, "could not parse compilation unit"));
            }
            return ParseResult.failure(file, errors);
        }
        List<Stmt> statements = new ArrayList<>();
        Normalizer normalizer = new Normalizer(file);
        for (TypeDeclaration<?> type : parsed.getResult().get().getTypes()) {
            statements.add(normalizer.type(type));
        }
        return ParseResult.success(file, statements);
    }

    private static final class Normalizer {

        private final SourceFile file;
        private final List<Stmt> pending = new ArrayList<>();
        private Origin current;

        Normalizer(SourceFile file) {
            this.file = file;
        }

        Stmt.ClassDef type(TypeDeclaration<?> type) {
            Origin classOrigin = origin(type, ControlContext.TOP);
            List<Stmt> body = new ArrayList<>();
            List<Stmt.Param> recordComponents = new ArrayList<>();

            if (type instanceof RecordDeclaration record) {
                for (Parameter p : record.getParameters()) {
                    recordComponents.add(param(p));
                    body.add(new Stmt.Assign(List.of(new Target.NameTarget(p.getNameAsString())), null,
                        p.getType().asString(), AssignForm.DECLARATION, origin(p, ControlContext.TOP)));
                }
            }
            if (type instanceof EnumDeclaration enumeration) {
                for (EnumConstantDeclaration constant : enumeration.getEntries()) {
                    body.add(new Stmt.Assign(List.of(new Target.NameTarget(constant.getNameAsString())), null,
                        enumeration.getNameAsString(), AssignForm.DECLARATION, origin(constant, ControlContext.TOP)));
                }
            }

            for (BodyDeclaration<?> member : type.getMembers()) {
                if (!(member instanceof FieldDeclaration field)) continue;
                for (VariableDeclarator v : field.getVariables()) {
                    current = origin(v, ControlContext.TOP);
                    Expr init = v.getInitializer().map(this::expr).orElse(null);
                    emit(body, new Stmt.Assign(List.of(new Target.NameTarget(v.getNameAsString())), init,
                        v.getType().asString(), init == null ? AssignForm.DECLARATION : AssignForm.PLAIN, current));
                }
            }

            for (BodyDeclaration<?> member : type.getMembers()) {
                if (member instanceof MethodDeclaration m) {
                    List<Stmt> methodBody = m.getBody().map(this::block).orElse(List.of());
                    body.add(new Stmt.FunctionDef(m.getNameAsString(), params(m.getParameters()), methodBody,
                        m.getType().asString(), origin(m, ControlContext.TOP)));
                } else if (member instanceof ConstructorDeclaration c) {
                    body.add(new Stmt.FunctionDef("<init>", params(c.getParameters()), block(c.getBody()),
                        null, origin(c, ControlContext.TOP)));
                } else if (member instanceof CompactConstructorDeclaration c) {
                    body.add(new Stmt.FunctionDef("<init>", recordComponents, block(c.getBody()),
                        null, origin(c, ControlContext.TOP)));
                } else if (member instanceof InitializerDeclaration init) {
                    body.add(new Stmt.FunctionDef(init.isStatic() ? "<clinit>" : "<init>", List.of(),
                        block(init.getBody()), null, origin(init, ControlContext.TOP)));
                } else if (member instanceof TypeDeclaration<?> nested) {
                    body.add(type(nested));
                }
            }
            return new Stmt.ClassDef(type.getNameAsString(), body, classOrigin);
        }

        private List<Stmt.Param> params(NodeList<Parameter> parameters) {
            List<Stmt.Param> params = new ArrayList<>();
            for (Parameter p : parameters) params.add(param(p));
            return params;
        }

        private Stmt.Param param(Parameter p) {
            return new Stmt.Param(p.getNameAsString(), p.getType().asString(),
                new Location(file.path(), line(p)));
        }

        private List<Stmt> block(BlockStmt block) {
            List<Stmt> out = new ArrayList<>();
            for (Statement s : block.getStatements()) {
                statement(s, ControlContext.TOP, out);
            }
            return out;
        }

        private void statement(Statement s, ControlContext ctx, List<Stmt> out) {
            if (s instanceof BlockStmt b) {
                for (Statement child : b.getStatements()) statement(child, ctx, out);
            } else if (s instanceof ExpressionStmt e) {
                expressionStatement(e.getExpression(), ctx, out);
            } else if (s instanceof IfStmt i) {
                ControlContext inner = ctx.enterConditional();
                current = origin(i, ctx);
                emit(out, new Stmt.ExprStmt(expr(i.getCondition()), current));
                statement(i.getThenStmt(), inner, out);
                i.getElseStmt().ifPresent(e -> statement(e, inner, out));
            } else if (s instanceof ForStmt f) {
                ControlContext loop = ctx.enterLoop();
                for (Expression init : f.getInitialization()) expressionStatement(init, ctx, out);
                if (f.getCompare().isPresent()) {
                    current = origin(f, loop);
                    emit(out, new Stmt.ExprStmt(expr(f.getCompare().get()), current));
                }
                statement(f.getBody(), loop, out);
                for (Expression update : f.getUpdate()) expressionStatement(update, loop, out);
            } else if (s instanceof ForEachStmt f) {
                ControlContext loop = ctx.enterLoop();
                current = origin(f, loop);
                VariableDeclarator v = f.getVariable().getVariables().get(0);
                emit(out, new Stmt.Assign(List.of(new Target.NameTarget(v.getNameAsString())), expr(f.getIterable()),
                    v.getType().asString(), AssignForm.LOOP_ELEMENT, current));
                statement(f.getBody(), loop, out);
            } else if (s instanceof WhileStmt w) {
                ControlContext loop = ctx.enterLoop();
                current = origin(w, loop);
                emit(out, new Stmt.ExprStmt(expr(w.getCondition()), current));
                statement(w.getBody(), loop, out);
            } else if (s instanceof DoStmt d) {
                ControlContext loop = ctx.enterLoop();
                statement(d.getBody(), loop, out);
                current = origin(d.getCondition(), loop);
                emit(out, new Stmt.ExprStmt(expr(d.getCondition()), current));
            } else if (s instanceof TryStmt t) {
                tryStatement(t, ctx, out);
            } else if (s instanceof SwitchStmt sw) {
                current = origin(sw, ctx);
                emit(out, new Stmt.ExprStmt(expr(sw.getSelector()), current));
                ControlContext inner = ctx.enterConditional();
                for (SwitchEntry entry : sw.getEntries()) {
                    for (Statement child : entry.getStatements()) statement(child, inner, out);
                }
            } else if (s instanceof LabeledStmt l) {
                statement(l.getStatement(), ctx, out);
            } else if (s instanceof SynchronizedStmt sync) {
                current = origin(sync, ctx);
                emit(out, new Stmt.ExprStmt(expr(sync.getExpression()), current));
                statement(sync.getBody(), ctx, out);
            } else if (s instanceof ThrowStmt t) {
                current = origin(t, ctx);
                emit(out, new Stmt.ExprStmt(expr(t.getExpression()), current));
            } else if (s instanceof ReturnStmt r) {
                current = origin(r, ctx);
                emit(out, new Stmt.Return(r.getExpression().map(this::expr).orElse(null), current));
            } else if (s instanceof AssertStmt a) {
                current = origin(a, ctx);
                emit(out, new Stmt.ExprStmt(expr(a.getCheck()), current));
            } else if (s instanceof ExplicitConstructorInvocationStmt call) {
                current = origin(call, ctx);
                List<Expr> args = new ArrayList<>();
                for (Expression arg : call.getArguments()) args.add(expr(arg));
                emit(out, new Stmt.ExprStmt(new Expr.Call(new Expr.Name(call.isThis() ? "this" : "super"),
                    args, List.of(), line(call)), current));
            } else if (s instanceof LocalClassDeclarationStmt local) {
                out.add(type(local.getClassDeclaration()));
            } else if (s instanceof LocalRecordDeclarationStmt local) {
                out.add(type(local.getRecordDeclaration()));
            } else if (s instanceof BreakStmt || s instanceof ContinueStmt || s instanceof EmptyStmt) {
                return;
            } else {
                out.add(new Stmt.Unsupported(s.getClass().getSimpleName(), origin(s, ctx)));
            }
        }

        private void tryStatement(TryStmt t, ControlContext ctx, List<Stmt> out) {
            for (Expression resource : t.getResources()) {
                current = origin(resource, ctx);
                if (resource instanceof VariableDeclarationExpr declaration) {
                    for (VariableDeclarator v : declaration.getVariables()) {
                        emit(out, new Stmt.Assign(List.of(new Target.NameTarget(v.getNameAsString())),
                            v.getInitializer().map(this::expr).orElse(null), v.getType().asString(),
                            AssignForm.CONTEXT_BINDING, current));
                    }
                } else {
                    emit(out, new Stmt.ExprStmt(expr(resource), current));
                }
            }
            statement(t.getTryBlock(), ctx, out);
            ControlContext handler = ctx.enterConditional();
            for (CatchClause c : t.getCatchClauses()) {
                Parameter p = c.getParameter();
                out.add(new Stmt.Assign(List.of(new Target.NameTarget(p.getNameAsString())), null,
                    p.getType().asString(), AssignForm.CATCH_BINDING, origin(c, handler)));
                statement(c.getBody(), handler, out);
            }
            t.getFinallyBlock().ifPresent(f -> statement(f, ctx, out));
        }

        private void expressionStatement(Expression e, ControlContext ctx, List<Stmt> out) {
            current = origin(e, ctx);
            if (e instanceof VariableDeclarationExpr declaration) {
                for (VariableDeclarator v : declaration.getVariables()) {
                    Expr init = v.getInitializer().map(this::expr).orElse(null);
                    emit(out, new Stmt.Assign(List.of(new Target.NameTarget(v.getNameAsString())), init,
                        v.getType().asString(), init == null ? AssignForm.DECLARATION : AssignForm.PLAIN, current));
                }
            } else if (e instanceof AssignExpr a) {
                Stmt assignment = assignment(a);
                emit(out, assignment);
            } else if (e instanceof UnaryExpr u && isStep(u)) {
                Stmt step = step(u);
                emit(out, step);
            } else {
                emit(out, new Stmt.ExprStmt(expr(e), current));
            }
        }

        /** {@code a = b = v} binds every target to the innermost value; {@code a += v} is augmented. */
        private Stmt assignment(AssignExpr a) {
            if (a.getOperator() != AssignExpr.Operator.ASSIGN) {
                String op = a.getOperator().asString();
                return new Stmt.AugAssign(target(a.getTarget()), op.substring(0, op.length() - 1),
                    expr(a.getValue()), current);
            }
            List<Target> targets = new ArrayList<>();
            targets.add(target(a.getTarget()));
            Expression value = a.getValue();
            while (value instanceof AssignExpr inner && inner.getOperator() == AssignExpr.Operator.ASSIGN) {
                targets.add(target(inner.getTarget()));
                value = inner.getValue();
            }
            return new Stmt.Assign(targets, expr(value), null, AssignForm.PLAIN, current);
        }

        private static boolean isStep(UnaryExpr u) {
            return switch (u.getOperator()) {
                case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
                default -> false;
            };
        }

        private Stmt step(UnaryExpr u) {
            boolean increment = u.getOperator() == UnaryExpr.Operator.PREFIX_INCREMENT
                || u.getOperator() == UnaryExpr.Operator.POSTFIX_INCREMENT;
            return new Stmt.AugAssign(target(u.getExpression()), increment ? "+" : "-",
                new Expr.Literal(LiteralKind.INT, "1"), current);
        }

        private Target target(Expression e) {
            if (e instanceof NameExpr n) return new Target.NameTarget(n.getNameAsString());
            if (e instanceof FieldAccessExpr f) return new Target.AttributeTarget(expr(f.getScope()), f.getNameAsString());
            if (e instanceof ArrayAccessExpr a) return new Target.SubscriptTarget(expr(a.getName()), expr(a.getIndex()));
            if (e instanceof EnclosedExpr enclosed) return target(enclosed.getInner());
            return new Target.NameTarget(e.toString());
        }

        private Expr binary(BinaryExpr root) {
            Deque<BinaryExpr> chain = new ArrayDeque<>();
            Expression innermost = root;
            while (innermost instanceof BinaryExpr b) {
                chain.push(b);
                innermost = b.getLeft();
            }
            Expr result = expr(innermost);
            while (!chain.isEmpty()) {
                BinaryExpr b = chain.pop();
                result = new Expr.Binary(b.getOperator().asString(), result, expr(b.getRight()));
            }
            return result;
        }

        private Expr expr(Expression e) {
            if (e instanceof NameExpr n) return new Expr.Name(n.getNameAsString());
            if (e instanceof ThisExpr || e instanceof SuperExpr) return new Expr.Name("this");
            if (e instanceof LiteralExpr literal) return literal(literal);
            if (e instanceof FieldAccessExpr f) return new Expr.Attribute(expr(f.getScope()), f.getNameAsString());
            if (e instanceof ArrayAccessExpr a) return new Expr.Subscript(expr(a.getName()), expr(a.getIndex()));
            if (e instanceof BinaryExpr b) return binary(b);
            if (e instanceof UnaryExpr u) {
                if (isStep(u)) {
                    pending.add(step(u));
                    return expr(u.getExpression());
                }
                return new Expr.Unary(u.getOperator().asString(), expr(u.getExpression()));
            }
            if (e instanceof ConditionalExpr c) {
                return new Expr.Conditional(expr(c.getCondition()), expr(c.getThenExpr()), expr(c.getElseExpr()));
            }
            if (e instanceof EnclosedExpr enclosed) return expr(enclosed.getInner());
            if (e instanceof MethodCallExpr call) {
                Expr callee = call.getScope()
                    .<Expr>map(scope -> new Expr.Attribute(expr(scope), call.getNameAsString()))
                    .orElseGet(() -> new Expr.Name(call.getNameAsString()));
                return new Expr.Call(callee, exprs(call.getArguments()), List.of(), line(call));
            }
            if (e instanceof ObjectCreationExpr creation) {
                return new Expr.New(creation.getType().getNameAsString(), exprs(creation.getArguments()), line(creation));
            }
            if (e instanceof ArrayCreationExpr array) {
                if (array.getInitializer().isPresent()) return expr(array.getInitializer().get());
                List<Expr> dimensions = new ArrayList<>();
                for (ArrayCreationLevel level : array.getLevels()) {
                    level.getDimension().ifPresent(d -> dimensions.add(expr(d)));
                }
                return new Expr.Container(ContainerKind.ARRAY, dimensions);
            }
            if (e instanceof ArrayInitializerExpr init) return new Expr.Container(ContainerKind.ARRAY, exprs(init.getValues()));
            if (e instanceof CastExpr cast) return new Expr.Cast(cast.getType().asString(), expr(cast.getExpression()));
            if (e instanceof InstanceOfExpr test) {
                return new Expr.Binary("instanceof", expr(test.getExpression()),
                    new Expr.Literal(LiteralKind.OTHER, test.getType().asString()));
            }
            if (e instanceof AssignExpr a) {
                pending.add(assignment(a));
                return expr(a.getTarget());
            }
            if (e instanceof ClassExpr || e instanceof TypeExpr) return new Expr.Literal(LiteralKind.OTHER, e.toString());
            if (e instanceof LambdaExpr) return new Expr.Unsupported("lambda", List.of());
            if (e instanceof MethodReferenceExpr) return new Expr.Unsupported("method reference", List.of());
            if (e instanceof SwitchExpr sw) return new Expr.Unsupported("switch expression", List.of(expr(sw.getSelector())));
            return new Expr.Unsupported(e.getClass().getSimpleName(), List.of());
        }

        private List<Expr> exprs(NodeList<Expression> expressions) {
            List<Expr> out = new ArrayList<>();
            for (Expression e : expressions) out.add(expr(e));
            return out;
        }

        private static Expr literal(LiteralExpr literal) {
            LiteralKind kind;
            if (literal instanceof IntegerLiteralExpr) kind = LiteralKind.INT;
            else if (literal instanceof LongLiteralExpr) kind = LiteralKind.LONG;
            else if (literal instanceof DoubleLiteralExpr) kind = LiteralKind.FLOAT;
            else if (literal instanceof StringLiteralExpr || literal instanceof TextBlockLiteralExpr) kind = LiteralKind.STRING;
            else if (literal instanceof CharLiteralExpr) kind = LiteralKind.CHAR;
            else if (literal instanceof BooleanLiteralExpr) kind = LiteralKind.BOOL;
            else if (literal instanceof NullLiteralExpr) kind = LiteralKind.NULL;
            else kind = LiteralKind.OTHER;
            return new Expr.Literal(kind, literal.toString());
        }

        private void emit(List<Stmt> out, Stmt stmt) {
            out.addAll(pending);
            pending.clear();
            out.add(stmt);
        }

        private Origin origin(Node node, ControlContext ctx) {
            int line = line(node);
            return new Origin(new Location(file.path(), line), ctx, file.line(line));
        }

        private int line(Node node) {
            return node.getBegin().map(p -> p.line).orElse(current == null ? 1 : current.line());
        }
    }
}
