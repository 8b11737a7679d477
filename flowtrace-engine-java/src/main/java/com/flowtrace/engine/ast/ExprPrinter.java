package com.flowtrace.engine.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a normalized expression back to compact, source-like text. Used for the
 * "expression" summary of graph nodes, so the same construct reads the same in every language.
 */
public final class ExprPrinter implements Expr.Visitor<String> {

    private static final ExprPrinter INSTANCE = new ExprPrinter();

    private ExprPrinter() {}

    public static String print(Expr expr) {
        return expr == null ? "" : expr.accept(INSTANCE);
    }

    public static String print(Target target) {
        return target.accept(new Target.Visitor<>() {
            public String visitName(Target.NameTarget t)           { return t.name(); }
            public String visitAttribute(Target.AttributeTarget t) { return print(t.base()) + "." + t.name(); }
            public String visitSubscript(Target.SubscriptTarget t) { return print(t.base()) + "[" + print(t.index()) + "]"; }
            public String visitTuple(Target.TupleTarget t) {
                return t.elements().stream().map(ExprPrinter::print).collect(Collectors.joining(", "));
            }
        });
    }

    @Override public String visitName(Expr.Name e)       { return e.id(); }
    @Override public String visitLiteral(Expr.Literal e) { return e.text(); }

    @Override
    public String visitAttribute(Expr.Attribute e) {
        return e.base().accept(this) + "." + e.name();
    }

    @Override
    public String visitSubscript(Expr.Subscript e) {
        return e.base().accept(this) + "[" + e.index().accept(this) + "]";
    }

    @Override
    public String visitBinary(Expr.Binary e) {
        Deque<Expr.Binary> chain = new ArrayDeque<>();
        Expr left = e;
        while (left instanceof Expr.Binary b) {
            chain.push(b);
            left = b.left();
        }
        StringBuilder out = new StringBuilder(left.accept(this));
        while (!chain.isEmpty()) {
            Expr.Binary b = chain.pop();
            out.append(' ').append(b.op()).append(' ').append(b.right().accept(this));
        }
        return out.toString();
    }

    @Override
    public String visitUnary(Expr.Unary e) {
        String operand = e.operand().accept(this);
        return switch (e.op()) {
            case "not" -> "not " + operand;
            case "x++", "x--" -> operand + e.op().substring(1);
            default -> e.op() + operand;
        };
    }

    @Override
    public String visitConditional(Expr.Conditional e) {
        return e.test().accept(this) + " ? " + e.whenTrue().accept(this) + " : " + e.whenFalse().accept(this);
    }

    @Override
    public String visitContainer(Expr.Container e) {
        if (e.kind() == Expr.ContainerKind.SLICE) {
            return join(e.elements(), ":");
        }
        if (e.kind() == Expr.ContainerKind.DICT) {
            List<String> pairs = new ArrayList<>();
            List<Expr> els = e.elements();
            for (int i = 0; i + 1 < els.size(); i += 2) {
                String value = els.get(i + 1).accept(this);
                pairs.add(value.isEmpty() ? els.get(i).accept(this) : els.get(i).accept(this) + ": " + value);
            }
            return "{" + String.join(", ", pairs) + "}";
        }
        String inner = join(e.elements(), ", ");
        return switch (e.kind()) {
            case LIST -> "[" + inner + "]";
            case SET, ARRAY -> "{" + inner + "}";
            default -> "(" + inner + ")";
        };
    }

    @Override
    public String visitCall(Expr.Call e) {
        List<String> args = new ArrayList<>();
        for (Expr a : e.args()) args.add(a.accept(this));
        for (Expr.Keyword k : e.keywords()) {
            args.add(k.name() == null ? "**" + k.value().accept(this) : k.name() + "=" + k.value().accept(this));
        }
        return e.callee().accept(this) + "(" + String.join(", ", args) + ")";
    }

    @Override
    public String visitNew(Expr.New e) {
        return "new " + e.type() + "(" + join(e.args(), ", ") + ")";
    }

    @Override
    public String visitCast(Expr.Cast e) {
        return "(" + e.type() + ") " + e.operand().accept(this);
    }

    @Override
    public String visitComprehension(Expr.Comprehension e) {
        String body = join(e.results(), ": ");
        return "[" + body + " for " + String.join(", ", e.loopVars()) + " in " + join(e.iterables(), ", ") + "]";
    }

    @Override
    public String visitFormattedString(Expr.FormattedString e) {
        return e.text();
    }

    @Override
    public String visitUnsupported(Expr.Unsupported e) {
        return "<" + e.construct() + ">";
    }

    private String join(List<Expr> exprs, String sep) {
        return exprs.stream().map(x -> x.accept(this)).collect(Collectors.joining(sep));
    }
}
