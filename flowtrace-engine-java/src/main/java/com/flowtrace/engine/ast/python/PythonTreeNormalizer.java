package com.flowtrace.engine.ast.python;

import com.flowtrace.engine.ast.ControlContext;
import com.flowtrace.engine.ast.Expr;
import com.flowtrace.engine.ast.Expr.ContainerKind;
import com.flowtrace.engine.ast.Expr.LiteralKind;
import com.flowtrace.engine.ast.ExprPrinter;
import com.flowtrace.engine.ast.Location;
import com.flowtrace.engine.ast.Origin;
import com.flowtrace.engine.ast.Stmt;
import com.flowtrace.engine.ast.Stmt.AssignForm;
import com.flowtrace.engine.ast.Target;
import com.flowtrace.engine.ast.python.Python3Parser.*;
import com.flowtrace.engine.source.SourceFile;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a {@code Python3Parser} tree and produces the normalized statement stream.
 *
 * Control-flow bodies are emitted inline with a deeper {@link ControlContext}; loop headers become
 * {@link AssignForm#LOOP_ELEMENT} assignments and branch tests become expression statements.
 * Assignment expressions ({@code :=}) are hoisted into plain assignments placed just before the
 * statement that contains them.
 */
class PythonTreeNormalizer {

    /** Placeholder for an omitted slice bound or the value slot of a dict unpacking. */
    private static final Expr EMPTY = new Expr.Literal(LiteralKind.OTHER, "");

    private final SourceFile file;
    private final int lineOffset;
    private final List<Stmt> pending = new ArrayList<>();
    private final ExpressionBuilder expressions = new ExpressionBuilder();
    private Origin current;

    PythonTreeNormalizer(SourceFile file) {
        this(file, 0, null);
    }

    private PythonTreeNormalizer(SourceFile file, int lineOffset, Origin current) {
        this.file = file;
        this.lineOffset = lineOffset;
        this.current = current;
    }

    List<Stmt> module(FileInputContext tree) {
        List<Stmt> out = new ArrayList<>();
        for (StmtContext stmt : tree.stmt()) {
            statement(stmt, ControlContext.TOP, out);
        }
        return out;
    }

    // ---- statements ----

    private void statement(StmtContext stmt, ControlContext ctx, List<Stmt> out) {
        if (stmt.simpleStmts() != null) {
            simpleStatements(stmt.simpleStmts(), ctx, out);
        } else {
            compound(stmt.compoundStmt(), ctx, out);
        }
    }

    private void compound(CompoundStmtContext c, ControlContext ctx, List<Stmt> out) {
        if (c.ifStmt() != null) {
            ifStatement(c.ifStmt(), ctx, out);
        } else if (c.whileStmt() != null) {
            whileStatement(c.whileStmt(), ctx, out);
        } else if (c.forStmt() != null) {
            forStatement(c.forStmt(), ctx, out);
        } else if (c.tryStmt() != null) {
            tryStatement(c.tryStmt(), ctx, out);
        } else if (c.withStmt() != null) {
            withStatement(c.withStmt(), ctx, out);
        } else if (c.funcdef() != null) {
            functionDef(c.funcdef(), ctx, out);
        } else if (c.classdef() != null) {
            classDef(c.classdef(), ctx, out);
        } else if (c.decorated() != null) {
            decorated(c.decorated(), ctx, out);
        } else if (c.asyncStmt() != null) {
            AsyncStmtContext async = c.asyncStmt();
            if (async.funcdef() != null) functionDef(async.funcdef(), ctx, out);
            else if (async.withStmt() != null) withStatement(async.withStmt(), ctx, out);
            else forStatement(async.forStmt(), ctx, out);
        } else if (c.matchStmt() != null) {
            current = origin(c.matchStmt().getStart(), ctx);
            out.add(new Stmt.Unsupported("match", current));
        }
    }

    private void block(BlockContext block, ControlContext ctx, List<Stmt> out) {
        if (block.simpleStmts() != null) {
            simpleStatements(block.simpleStmts(), ctx, out);
            return;
        }
        for (StmtContext stmt : block.stmt()) {
            statement(stmt, ctx, out);
        }
    }

    private void decorated(DecoratedContext d, ControlContext ctx, List<Stmt> out) {
        for (DecoratorContext decorator : d.decorator()) {
            current = origin(decorator.getStart(), ctx);
            expressions.visit(decorator.namedExprTest());
        }
        flush(out);
        if (d.classdef() != null) classDef(d.classdef(), ctx, out);
        else if (d.funcdef() != null) functionDef(d.funcdef(), ctx, out);
        else functionDef(d.asyncFuncdef().funcdef(), ctx, out);
    }

    private void functionDef(FuncdefContext def, ControlContext ctx, List<Stmt> out) {
        Origin defOrigin = origin(def.getStart(), ctx);
        current = defOrigin;
        List<Stmt.Param> params = new ArrayList<>();
        ParamListContext list = def.parameters().paramList();
        if (list != null) {
            for (ParamItemContext item : list.paramItem()) {
                if (item.param() != null) params.add(param(item.param()));
            }
        }
        String returnType = def.test() == null ? null : ExprPrinter.print(expressions.visit(def.test()));
        flush(out);
        List<Stmt> body = new ArrayList<>();
        block(def.block(), ControlContext.TOP, body);
        out.add(new Stmt.FunctionDef(def.NAME().getText(), params, body, returnType, defOrigin));
    }

    private Stmt.Param param(ParamContext param) {
        String annotation = param.test() == null ? null : ExprPrinter.print(expressions.visit(param.test()));
        return new Stmt.Param(param.NAME().getText(), annotation,
            new Location(file.path(), line(param.NAME().getSymbol())));
    }

    private void classDef(ClassdefContext cls, ControlContext ctx, List<Stmt> out) {
        Origin classOrigin = origin(cls.getStart(), ctx);
        current = classOrigin;
        flush(out);
        List<Stmt> body = new ArrayList<>();
        block(cls.block(), ControlContext.TOP, body);
        out.add(new Stmt.ClassDef(cls.NAME().getText(), body, classOrigin));
    }

    private void ifStatement(IfStmtContext stmt, ControlContext ctx, List<Stmt> out) {
        ControlContext inner = ctx.enterConditional();
        for (ParseTree child : stmt.children) {
            if (child instanceof TerminalNode keyword) {
                int type = keyword.getSymbol().getType();
                if (type == Python3Parser.IF) current = origin(keyword.getSymbol(), ctx);
                else if (type == Python3Parser.ELIF) current = origin(keyword.getSymbol(), inner);
            } else if (child instanceof NamedExprTestContext test) {
                emit(out, new Stmt.ExprStmt(expressions.visit(test), current));
            } else if (child instanceof BlockContext body) {
                block(body, inner, out);
            }
        }
    }

    private void whileStatement(WhileStmtContext stmt, ControlContext ctx, List<Stmt> out) {
        ControlContext loop = ctx.enterLoop();
        current = origin(stmt.getStart(), loop);
        emit(out, new Stmt.ExprStmt(expressions.visit(stmt.namedExprTest()), current));
        block(stmt.block(0), loop, out);
        if (stmt.block().size() > 1) {
            block(stmt.block(1), ctx.enterConditional(), out);
        }
    }

    private void forStatement(ForStmtContext stmt, ControlContext ctx, List<Stmt> out) {
        ControlContext loop = ctx.enterLoop();
        current = origin(stmt.getStart(), loop);
        Expr target = expressions.visit(stmt.exprlist());
        Expr iterable = expressions.visit(stmt.testlist());
        emit(out, new Stmt.Assign(List.of(toTarget(target)), iterable, null, AssignForm.LOOP_ELEMENT, current));
        block(stmt.block(0), loop, out);
        if (stmt.block().size() > 1) {
            block(stmt.block(1), ctx.enterConditional(), out);
        }
    }

    private void tryStatement(TryStmtContext stmt, ControlContext ctx, List<Stmt> out) {
        ControlContext handler = ctx.enterConditional();
        int section = Python3Parser.TRY;
        for (ParseTree child : stmt.children) {
            if (child instanceof TerminalNode keyword && keyword.getSymbol().getType() != Python3Parser.COLON) {
                section = keyword.getSymbol().getType();
            } else if (child instanceof ExceptClauseContext clause) {
                exceptClause(clause, handler, out);
            } else if (child instanceof BlockContext body) {
                block(body, section == Python3Parser.ELSE ? handler : ctx, out);
            }
        }
    }

    private void exceptClause(ExceptClauseContext clause, ControlContext handler, List<Stmt> out) {
        if (clause.test() != null) {
            current = origin(clause.getStart(), handler);
            Expr type = expressions.visit(clause.test());
            if (clause.NAME() != null) {
                emit(out, new Stmt.Assign(List.of(new Target.NameTarget(clause.NAME().getText())), null,
                    ExprPrinter.print(type), AssignForm.CATCH_BINDING, current));
            }
        }
        block(clause.block(), handler, out);
    }

    private void withStatement(WithStmtContext stmt, ControlContext ctx, List<Stmt> out) {
        current = origin(stmt.getStart(), ctx);
        for (WithItemContext item : stmt.withItem()) {
            Expr manager = expressions.visit(item.test());
            if (item.expr() != null) {
                Expr target = expressions.visit(item.expr());
                emit(out, new Stmt.Assign(List.of(toTarget(target)), manager, null,
                    AssignForm.CONTEXT_BINDING, current));
            } else {
                emit(out, new Stmt.ExprStmt(manager, current));
            }
        }
        block(stmt.block(), ctx, out);
    }

    private void simpleStatements(SimpleStmtsContext line, ControlContext ctx, List<Stmt> out) {
        for (SmallStmtContext small : line.smallStmt()) {
            simpleStatement(small, ctx, out);
        }
    }

    private void simpleStatement(SmallStmtContext small, ControlContext ctx, List<Stmt> out) {
        current = origin(small.getStart(), ctx);
        if (small.exprStmt() != null) {
            expressionStatement(small.exprStmt(), out);
        } else if (small.returnStmt() != null) {
            TestlistStarExprContext value = small.returnStmt().testlistStarExpr();
            emit(out, new Stmt.Return(value == null ? null : expressions.visit(value), current));
        } else if (small.yieldStmt() != null) {
            emit(out, new Stmt.Return(yieldValue(small.yieldStmt().yieldExpr()), current));
        } else if (small.raiseStmt() != null) {
            List<TestContext> tests = small.raiseStmt().test();
            if (!tests.isEmpty()) {
                Expr raised = expressions.visit(tests.get(0));
                if (tests.size() > 1) expressions.visit(tests.get(1));
                emit(out, new Stmt.ExprStmt(raised, current));
            }
        } else if (small.assertStmt() != null) {
            List<TestContext> tests = small.assertStmt().test();
            Expr condition = expressions.visit(tests.get(0));
            if (tests.size() > 1) expressions.visit(tests.get(1));
            emit(out, new Stmt.ExprStmt(condition, current));
        } else if (small.globalStmt() != null) {
            emit(out, new Stmt.GlobalDecl(names(small.globalStmt().NAME()), false, current));
        } else if (small.nonlocalStmt() != null) {
            emit(out, new Stmt.GlobalDecl(names(small.nonlocalStmt().NAME()), true, current));
        } else if (small.delStmt() != null) {
            out.add(new Stmt.Unsupported("del", current));
        }
        // pass, break, continue and imports carry no data flow
    }

    private static List<String> names(List<TerminalNode> nodes) {
        List<String> names = new ArrayList<>();
        for (TerminalNode node : nodes) names.add(node.getText());
        return names;
    }

    private void expressionStatement(ExprStmtContext stmt, List<Stmt> out) {
        Expr first = expressions.visit(stmt.testlistStarExpr());
        if (stmt.annassign() != null) {
            AnnassignContext annotated = stmt.annassign();
            String annotation = ExprPrinter.print(expressions.visit(annotated.test()));
            Expr value = annotated.assignValue() == null ? null : assignedValue(annotated.assignValue());
            emit(out, new Stmt.Assign(List.of(toTarget(first)), value, annotation,
                value == null ? AssignForm.DECLARATION : AssignForm.PLAIN, current));
        } else if (stmt.augassign() != null) {
            String op = stmt.augassign().getText();
            Expr value = assignedValue(stmt.assignValue(0));
            emit(out, new Stmt.AugAssign(toTarget(first), op.substring(0, op.length() - 1), value, current));
        } else if (!stmt.assignValue().isEmpty()) {
            List<Expr> chain = new ArrayList<>();
            chain.add(first);
            for (AssignValueContext value : stmt.assignValue()) {
                chain.add(assignedValue(value));
            }
            Expr value = chain.remove(chain.size() - 1);
            List<Target> targets = new ArrayList<>();
            for (Expr e : chain) targets.add(toTarget(e));
            emit(out, new Stmt.Assign(targets, value, null, AssignForm.PLAIN, current));
        } else {
            emit(out, new Stmt.ExprStmt(first, current));
        }
    }

    private Expr assignedValue(AssignValueContext value) {
        if (value.yieldExpr() != null) return yieldExpression(value.yieldExpr());
        return expressions.visit(value.testlistStarExpr());
    }

    private Expr yieldValue(YieldExprContext yield) {
        YieldArgContext arg = yield.yieldArg();
        if (arg == null) return null;
        if (arg.test() != null) return expressions.visit(arg.test());
        return expressions.visit(arg.testlistStarExpr());
    }

    private Expr yieldExpression(YieldExprContext yield) {
        Expr value = yieldValue(yield);
        return new Expr.Unsupported("yield", value == null ? List.of() : List.of(value));
    }

    private Target toTarget(Expr e) {
        if (e instanceof Expr.Name n) return new Target.NameTarget(n.id());
        if (e instanceof Expr.Attribute a) return new Target.AttributeTarget(a.base(), a.name());
        if (e instanceof Expr.Subscript s) return new Target.SubscriptTarget(s.base(), s.index());
        if (e instanceof Expr.Container c && (c.kind() == ContainerKind.TUPLE || c.kind() == ContainerKind.LIST)) {
            List<Target> elements = new ArrayList<>();
            for (Expr element : c.elements()) elements.add(toTarget(element));
            return new Target.TupleTarget(elements);
        }
        if (e instanceof Expr.Unary u && u.op().equals("*")) return toTarget(u.operand());
        throw new PythonSyntaxException("cannot assign to " + ExprPrinter.print(e), current.line(), 1);
    }

    // ---- expressions ----

    /** Builds normalized expressions; walrus assignments it meets go to {@code pending}. */
    private class ExpressionBuilder extends Python3ParserBaseVisitor<Expr> {

        @Override
        public Expr visitTestlistStarExpr(TestlistStarExprContext ctx) {
            return sequence(ctx);
        }

        @Override
        public Expr visitExprlist(ExprlistContext ctx) {
            return sequence(ctx);
        }

        @Override
        public Expr visitTestlist(TestlistContext ctx) {
            return sequence(ctx);
        }

        /** A single element without a trailing comma is the element itself; anything else a tuple. */
        private Expr sequence(ParserRuleContext ctx) {
            List<Expr> elements = elements(ctx);
            if (ctx.getChildCount() == 1) return elements.get(0);
            return new Expr.Container(ContainerKind.TUPLE, elements);
        }

        private List<Expr> elements(ParserRuleContext ctx) {
            List<Expr> elements = new ArrayList<>();
            for (ParseTree child : ctx.children) {
                if (child instanceof ParserRuleContext) elements.add(visit(child));
            }
            return elements;
        }

        @Override
        public Expr visitStarExpr(StarExprContext ctx) {
            return new Expr.Unary("*", visit(ctx.expr()));
        }

        @Override
        public Expr visitNamedExprTest(NamedExprTestContext ctx) {
            if (ctx.test().size() == 1) return visit(ctx.test(0));
            Expr target = visit(ctx.test(0));
            if (!(target instanceof Expr.Name name)) {
                Token at = ctx.getStart();
                throw new PythonSyntaxException("cannot use assignment expressions with " + ExprPrinter.print(target),
                    line(at), at.getCharPositionInLine() + 1);
            }
            Expr value = visit(ctx.test(1));
            pending.add(new Stmt.Assign(List.of(new Target.NameTarget(name.id())), value, null,
                AssignForm.PLAIN, current));
            return name;
        }

        @Override
        public Expr visitTest(TestContext ctx) {
            if (ctx.lambdef() != null) return new Expr.Unsupported("lambda", List.of());
            Expr value = visit(ctx.orTest(0));
            if (ctx.orTest().size() == 1) return value;
            Expr condition = visit(ctx.orTest(1));
            return new Expr.Conditional(condition, value, visit(ctx.test()));
        }

        @Override public Expr visitOrTest(OrTestContext ctx)       { return fold(ctx); }
        @Override public Expr visitAndTest(AndTestContext ctx)     { return fold(ctx); }
        @Override public Expr visitExpr(ExprContext ctx)           { return fold(ctx); }
        @Override public Expr visitXorExpr(XorExprContext ctx)     { return fold(ctx); }
        @Override public Expr visitAndExpr(AndExprContext ctx)     { return fold(ctx); }
        @Override public Expr visitShiftExpr(ShiftExprContext ctx) { return fold(ctx); }
        @Override public Expr visitArithExpr(ArithExprContext ctx) { return fold(ctx); }
        @Override public Expr visitTerm(TermContext ctx)           { return fold(ctx); }

        /** Operands alternate with operator tokens; the chain is left-associative. */
        private Expr fold(ParserRuleContext ctx) {
            Expr left = visit(ctx.getChild(0));
            for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
                left = new Expr.Binary(ctx.getChild(i).getText(), left, visit(ctx.getChild(i + 1)));
            }
            return left;
        }

        @Override
        public Expr visitNotTest(NotTestContext ctx) {
            if (ctx.notTest() != null) return new Expr.Unary("not", visit(ctx.notTest()));
            return visit(ctx.comparison());
        }

        @Override
        public Expr visitComparison(ComparisonContext ctx) {
            Expr left = visit(ctx.expr(0));
            for (int i = 0; i < ctx.compOp().size(); i++) {
                List<String> words = new ArrayList<>();
                for (ParseTree token : ctx.compOp(i).children) words.add(token.getText());
                left = new Expr.Binary(String.join(" ", words), left, visit(ctx.expr(i + 1)));
            }
            return left;
        }

        @Override
        public Expr visitFactor(FactorContext ctx) {
            if (ctx.factor() != null) return new Expr.Unary(ctx.getChild(0).getText(), visit(ctx.factor()));
            return visit(ctx.power());
        }

        @Override
        public Expr visitPower(PowerContext ctx) {
            Expr base = visit(ctx.atomExpr());
            if (ctx.factor() == null) return base;
            return new Expr.Binary("**", base, visit(ctx.factor()));
        }

        @Override
        public Expr visitAtomExpr(AtomExprContext ctx) {
            Expr e = visit(ctx.atom());
            for (TrailerContext trailer : ctx.trailer()) {
                if (trailer instanceof CallTrailerContext call) {
                    e = call(e, call.arglist(), line(call.getStart()));
                } else if (trailer instanceof SubscriptTrailerContext subscript) {
                    e = new Expr.Subscript(e, subscripts(subscript.subscriptlist()));
                } else if (trailer instanceof AttributeTrailerContext attribute) {
                    e = new Expr.Attribute(e, attribute.NAME().getText());
                }
            }
            return e;
        }

        private Expr.Call call(Expr callee, ArglistContext arglist, int line) {
            List<Expr> args = new ArrayList<>();
            List<Expr.Keyword> keywords = new ArrayList<>();
            if (arglist != null) {
                for (ArgumentContext argument : arglist.argument()) {
                    if (argument instanceof StarredArgumentContext starred) {
                        args.add(new Expr.Unary("*", visit(starred.test())));
                    } else if (argument instanceof KwargsArgumentContext kwargs) {
                        keywords.add(new Expr.Keyword(null, visit(kwargs.test())));
                    } else if (argument instanceof KeywordArgumentContext keyword) {
                        keywords.add(new Expr.Keyword(keyword.NAME().getText(), visit(keyword.test())));
                    } else if (argument instanceof PositionalArgumentContext positional) {
                        Expr value = visit(positional.namedExprTest());
                        if (positional.compFor() != null) {
                            value = comprehension(ContainerKind.GENERATOR, List.of(value), positional.compFor());
                        }
                        args.add(value);
                    }
                }
            }
            return new Expr.Call(callee, args, keywords, line);
        }

        private Expr subscripts(SubscriptlistContext list) {
            List<Expr> items = new ArrayList<>();
            for (SubscriptContext subscript : list.subscript()) items.add(subscript(subscript));
            if (list.getChildCount() == 1) return items.get(0);
            return new Expr.Container(ContainerKind.TUPLE, items);
        }

        private Expr subscript(SubscriptContext subscript) {
            if (subscript instanceof StarredSubscriptContext starred) return visit(starred.starExpr());
            if (subscript instanceof IndexSubscriptContext index) {
                Expr lower = visit(index.namedExprTest());
                return index.slice() == null ? lower : slice(lower, index.slice());
            }
            return slice(EMPTY, ((SliceSubscriptContext) subscript).slice());
        }

        private Expr slice(Expr lower, SliceContext slice) {
            List<Expr> parts = new ArrayList<>();
            parts.add(lower);
            parts.add(slice.upper == null ? EMPTY : visit(slice.upper));
            if (slice.COLON().size() > 1) parts.add(slice.step == null ? EMPTY : visit(slice.step));
            return new Expr.Container(ContainerKind.SLICE, parts);
        }

        @Override
        public Expr visitParenAtom(ParenAtomContext ctx) {
            if (ctx.yieldExpr() != null) return yieldExpression(ctx.yieldExpr());
            TestlistCompContext items = ctx.testlistComp();
            if (items == null) return new Expr.Container(ContainerKind.TUPLE, List.of());
            if (items.compFor() != null) {
                return comprehension(ContainerKind.GENERATOR, List.of(visit(items.getChild(0))), items.compFor());
            }
            List<Expr> elements = elements(items);
            if (items.getChildCount() == 1) return elements.get(0);
            return new Expr.Container(ContainerKind.TUPLE, elements);
        }

        @Override
        public Expr visitListAtom(ListAtomContext ctx) {
            TestlistCompContext items = ctx.testlistComp();
            if (items == null) return new Expr.Container(ContainerKind.LIST, List.of());
            if (items.compFor() != null) {
                return comprehension(ContainerKind.LIST, List.of(visit(items.getChild(0))), items.compFor());
            }
            return new Expr.Container(ContainerKind.LIST, elements(items));
        }

        @Override
        public Expr visitBraceAtom(BraceAtomContext ctx) {
            DictOrSetMakerContext maker = ctx.dictOrSetMaker();
            if (maker == null) return new Expr.Container(ContainerKind.DICT, List.of());
            if (maker instanceof DictMakerContext dict) {
                List<Expr> entries = new ArrayList<>();
                for (DictEntryContext entry : dict.dictEntry()) {
                    if (entry.expr() != null) {
                        entries.add(new Expr.Unary("**", visit(entry.expr())));
                        entries.add(EMPTY);
                    } else {
                        entries.add(visit(entry.test(0)));
                        entries.add(visit(entry.test(1)));
                    }
                }
                if (dict.compFor() != null) return comprehension(ContainerKind.DICT, entries, dict.compFor());
                return new Expr.Container(ContainerKind.DICT, entries);
            }
            SetMakerContext set = (SetMakerContext) maker;
            if (set.compFor() != null) {
                return comprehension(ContainerKind.SET, List.of(visit(set.getChild(0))), set.compFor());
            }
            return new Expr.Container(ContainerKind.SET, elements(set));
        }

        private Expr comprehension(ContainerKind kind, List<Expr> results, CompForContext first) {
            List<String> loopVars = new ArrayList<>();
            List<Expr> iterables = new ArrayList<>();
            List<Expr> conditions = new ArrayList<>();
            CompForContext loop = first;
            while (loop != null) {
                collectNames(visit(loop.exprlist()), loopVars);
                iterables.add(visit(loop.orTest()));
                CompIterContext next = loop.compIter();
                loop = null;
                while (next != null) {
                    if (next.compFor() != null) {
                        loop = next.compFor();
                        break;
                    }
                    conditions.add(visit(next.compIf().orTest()));
                    next = next.compIf().compIter();
                }
            }
            return new Expr.Comprehension(kind, List.copyOf(results), loopVars, iterables, conditions);
        }

        @Override
        public Expr visitNameAtom(NameAtomContext ctx) {
            return new Expr.Name(ctx.NAME().getText());
        }

        @Override
        public Expr visitNumberAtom(NumberAtomContext ctx) {
            return number(ctx.NUMBER().getText());
        }

        @Override
        public Expr visitStringAtom(StringAtomContext ctx) {
            return strings(ctx.STRING());
        }

        @Override
        public Expr visitEllipsisAtom(EllipsisAtomContext ctx) {
            return new Expr.Literal(LiteralKind.OTHER, "...");
        }

        @Override
        public Expr visitNoneAtom(NoneAtomContext ctx) {
            return new Expr.Literal(LiteralKind.NULL, ctx.getText());
        }

        @Override
        public Expr visitBoolAtom(BoolAtomContext ctx) {
            return new Expr.Literal(LiteralKind.BOOL, ctx.getText());
        }

        @Override
        public Expr visitYieldExpr(YieldExprContext ctx) {
            return yieldExpression(ctx);
        }
    }

    private static void collectNames(Expr target, List<String> names) {
        if (target instanceof Expr.Name n) {
            names.add(n.id());
        } else if (target instanceof Expr.Container c) {
            for (Expr e : c.elements()) collectNames(e, names);
        } else if (target instanceof Expr.Unary u) {
            collectNames(u.operand(), names);
        }
    }

    private static Expr number(String text) {
        String lower = text.toLowerCase();
        if (lower.endsWith("j")) return new Expr.Literal(LiteralKind.OTHER, text);
        if (lower.startsWith("0x") || lower.startsWith("0o") || lower.startsWith("0b")) {
            return new Expr.Literal(LiteralKind.INT, text);
        }
        if (lower.contains(".") || lower.contains("e")) return new Expr.Literal(LiteralKind.FLOAT, text);
        return new Expr.Literal(LiteralKind.INT, text);
    }

    /** Adjacent string tokens concatenate into one literal. */
    private Expr strings(List<TerminalNode> tokens) {
        List<String> texts = new ArrayList<>();
        List<Expr> parts = new ArrayList<>();
        boolean formatted = false;
        boolean bytes = false;
        for (TerminalNode node : tokens) {
            Token t = node.getSymbol();
            texts.add(t.getText());
            String prefix = prefixOf(t.getText()).toLowerCase();
            if (prefix.contains("b")) bytes = true;
            if (prefix.contains("f")) {
                formatted = true;
                parts.addAll(replacementFields(t));
            }
        }
        String text = String.join(" ", texts);
        if (formatted) return new Expr.FormattedString(text, parts);
        return new Expr.Literal(bytes ? LiteralKind.BYTES : LiteralKind.STRING, text);
    }

    private static String prefixOf(String literal) {
        int i = 0;
        while (i < literal.length() && literal.charAt(i) != '"' && literal.charAt(i) != '\'') i++;
        return literal.substring(0, i);
    }

    private List<Expr> replacementFields(Token t) {
        String raw = t.getText();
        int quoteAt = prefixOf(raw).length();
        char quote = raw.charAt(quoteAt);
        int quoteLength = raw.startsWith(String.valueOf(quote).repeat(3), quoteAt) && raw.length() - quoteAt >= 6 ? 3 : 1;
        String body = raw.substring(quoteAt + quoteLength, raw.length() - quoteLength);

        List<Expr> fields = new ArrayList<>();
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '{') {
                i++;
                continue;
            }
            if (i + 1 < body.length() && body.charAt(i + 1) == '{') {
                i += 2;
                continue;
            }
            int end = fieldEnd(body, i + 1);
            if (end < 0) break;
            String expression = body.substring(i + 1, end).trim();
            if (!expression.isEmpty()) fields.add(fieldExpression(expression, line(t)));
            i = fieldClose(body, end) + 1;
        }
        return fields;
    }

    /** Index where the expression of a replacement field ends ({@code }, !, :} or a trailing {@code =}). */
    private static int fieldEnd(String body, int start) {
        int depth = 0;
        char inQuote = 0;
        for (int j = start; j < body.length(); j++) {
            char ch = body.charAt(j);
            if (inQuote != 0) {
                if (ch == inQuote) inQuote = 0;
                continue;
            }
            switch (ch) {
                case '\'', '"' -> inQuote = ch;
                case '(', '[', '{' -> depth++;
                case ')', ']' -> depth--;
                case '}' -> {
                    if (depth == 0) return j;
                    depth--;
                }
                case '!' -> {
                    if (depth == 0 && (j + 1 >= body.length() || body.charAt(j + 1) != '=')) return j;
                }
                case ':' -> {
                    if (depth == 0) return j;
                }
                case '=' -> {
                    char next = j + 1 < body.length() ? body.charAt(j + 1) : '}';
                    char prev = body.charAt(j - 1);
                    if (depth == 0 && (next == '}' || next == '!' || next == ':') && "=!<>".indexOf(prev) < 0) return j;
                }
                default -> { }
            }
        }
        return -1;
    }

    /** Index of the brace closing a field, skipping a format spec with nested fields. */
    private static int fieldClose(String body, int from) {
        int depth = 0;
        for (int j = from; j < body.length(); j++) {
            char ch = body.charAt(j);
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                if (depth == 0) return j;
                depth--;
            }
        }
        return body.length();
    }

    /** Parses a replacement field of a formatted string with the {@code fieldInput} rule. */
    private Expr fieldExpression(String text, int line) {
        PythonAdapter.SyntaxErrors errors = new PythonAdapter.SyntaxErrors(file.path());
        FieldInputContext field = PythonAdapter.parser(text, file.path(), errors).fieldInput();
        if (errors.any()) {
            return new Expr.Unsupported("format-field", List.of());
        }
        PythonTreeNormalizer sub = new PythonTreeNormalizer(file, line - 1, current);
        try {
            Expr e = sub.expressions.visit(field.testlistStarExpr());
            pending.addAll(sub.pending);
            return e;
        } catch (PythonSyntaxException e) {
            return new Expr.Unsupported("format-field", List.of());
        }
    }

    // ---- helpers ----

    private void emit(List<Stmt> out, Stmt stmt) {
        flush(out);
        out.add(stmt);
    }

    private void flush(List<Stmt> out) {
        out.addAll(pending);
        pending.clear();
    }

    private Origin origin(Token t, ControlContext ctx) {
        int line = line(t);
        return new Origin(new Location(file.path(), line), ctx, file.line(line));
    }

    private int line(Token t) {
        return t.getLine() + lineOffset;
    }
}
