package com.flowtrace.engine.ast;

import java.util.List;

/**
 * Normalized expression tree shared by all front ends.
 *
 * The hierarchy is closed: every consumer implements {@link Visitor}, so adding a variant is a
 * compile error in each consumer until it is handled. Constructs a front end does not model are
 * carried as {@link Unsupported} with their operands, never dropped silently.
 */
public sealed interface Expr {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitName(Name e);
        R visitLiteral(Literal e);
        R visitAttribute(Attribute e);
        R visitSubscript(Subscript e);
        R visitBinary(Binary e);
        R visitUnary(Unary e);
        R visitConditional(Conditional e);
        R visitContainer(Container e);
        R visitCall(Call e);
        R visitNew(New e);
        R visitCast(Cast e);
        R visitComprehension(Comprehension e);
        R visitFormattedString(FormattedString e);
        R visitUnsupported(Unsupported e);
    }

    enum LiteralKind { INT, LONG, FLOAT, STRING, CHAR, BOOL, NULL, BYTES, OTHER }

    enum ContainerKind { LIST, TUPLE, SET, DICT, ARRAY, GENERATOR, SLICE }

    /** A plain identifier reference. */
    record Name(String id) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitName(this); }
    }

    /** A literal; {@code text} is the source spelling. */
    record Literal(LiteralKind kind, String text) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitLiteral(this); }
    }

    record Attribute(Expr base, String name) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitAttribute(this); }
    }

    record Subscript(Expr base, Expr index) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitSubscript(this); }
    }

    /** Arithmetic, bitwise, boolean and comparison operators alike. */
    record Binary(String op, Expr left, Expr right) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitBinary(this); }
    }

    record Unary(String op, Expr operand) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitUnary(this); }
    }

    record Conditional(Expr test, Expr whenTrue, Expr whenFalse) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitConditional(this); }
    }

    /** Container display; for dicts the elements alternate key, value. */
    record Container(ContainerKind kind, List<Expr> elements) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitContainer(this); }
    }

    record Keyword(String name, Expr value) {}

    /**
     * A call. {@code callee} is a {@link Name} for plain calls and an {@link Attribute} for method
     * calls, whose base is the receiver.
     */
    record Call(Expr callee, List<Expr> args, List<Keyword> keywords, int line) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitCall(this); }

        /** Last segment of the callee: {@code f} for {@code f(x)}, {@code info} for {@code log.info(x)}. */
        public String calleeName() {
            if (callee instanceof Name n) return n.id();
            if (callee instanceof Attribute a) return a.name();
            return null;
        }

        /** The receiver of a method call, or null for a plain call. */
        public Expr receiver() {
            return callee instanceof Attribute a ? a.base() : null;
        }
    }

    /** Explicit construction, e.g. {@code new Foo(a)}. */
    record New(String type, List<Expr> args, int line) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitNew(this); }
    }

    record Cast(String type, Expr operand) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitCast(this); }
    }

    /**
     * A comprehension. Its loop variables are bound only inside {@code results} and
     * {@code conditions}; they never become variables of the enclosing scope.
     */
    record Comprehension(ContainerKind kind, List<Expr> results, List<String> loopVars,
                         List<Expr> iterables, List<Expr> conditions) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitComprehension(this); }
    }

    /** A string with interpolated parts (f-strings). */
    record FormattedString(String text, List<Expr> parts) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitFormattedString(this); }
    }

    record Unsupported(String construct, List<Expr> operands) implements Expr {
        public <R> R accept(Visitor<R> v) { return v.visitUnsupported(this); }
    }
}
