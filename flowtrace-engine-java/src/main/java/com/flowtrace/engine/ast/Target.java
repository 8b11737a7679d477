package com.flowtrace.engine.ast;

import java.util.List;

/**
 * Left-hand side of an assignment.
 */
public sealed interface Target {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitName(NameTarget t);
        R visitAttribute(AttributeTarget t);
        R visitSubscript(SubscriptTarget t);
        R visitTuple(TupleTarget t);
    }

    record NameTarget(String name) implements Target {
        public <R> R accept(Visitor<R> v) { return v.visitName(this); }
    }

    /** {@code base.name = ...}; a write to object state. */
    record AttributeTarget(Expr base, String name) implements Target {
        public <R> R accept(Visitor<R> v) { return v.visitAttribute(this); }
    }

    /** {@code base[index] = ...}; mutates the container held by {@code base}. */
    record SubscriptTarget(Expr base, Expr index) implements Target {
        public <R> R accept(Visitor<R> v) { return v.visitSubscript(this); }
    }

    /** Destructuring: {@code a, b = pair}. */
    record TupleTarget(List<Target> elements) implements Target {
        public <R> R accept(Visitor<R> v) { return v.visitTuple(this); }
    }
}
