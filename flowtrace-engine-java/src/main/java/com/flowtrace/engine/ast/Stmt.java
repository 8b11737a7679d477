package com.flowtrace.engine.ast;

import java.util.List;

/**
 * Normalized statement stream. Control-flow statements are flattened by the front ends: their
 * bodies appear inline, in source order, with the nesting recorded in each statement's
 * {@link Origin#context()}. Only function and class bodies stay nested.
 */
public sealed interface Stmt {

    Origin origin();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAssign(Assign s);
        R visitAugAssign(AugAssign s);
        R visitExpression(ExprStmt s);
        R visitReturn(Return s);
        R visitFunction(FunctionDef s);
        R visitClass(ClassDef s);
        R visitGlobal(GlobalDecl s);
        R visitUnsupported(Unsupported s);
    }

    enum AssignForm {
        PLAIN,
        /** Declared without a value; {@code value} is null. */
        DECLARATION,
        /** Loop variable bound from each element of {@code value}. */
        LOOP_ELEMENT,
        /** {@code with x as y} or a try-with-resources variable. */
        CONTEXT_BINDING,
        /** Exception variable of a handler; {@code value} is null. */
        CATCH_BINDING
    }

    /**
     * One or more targets bound to the same value. {@code a = b = c = v} has three targets.
     */
    record Assign(List<Target> targets, Expr value, String declaredType, AssignForm form,
                  Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitAssign(this); }
    }

    /** {@code target op= value}: reads and writes the same variable. */
    record AugAssign(Target target, String op, Expr value, Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitAugAssign(this); }
    }

    record ExprStmt(Expr expr, Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitExpression(this); }
    }

    /** {@code value} is null for a bare return. */
    record Return(Expr value, Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitReturn(this); }
    }

    record Param(String name, String declaredType, Location location) {}

    record FunctionDef(String name, List<Param> params, List<Stmt> body, String returnType,
                       Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitFunction(this); }
    }

    record ClassDef(String name, List<Stmt> body, Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitClass(this); }
    }

    /** {@code global a, b} ({@code outer == false}) or {@code nonlocal a, b} ({@code outer == true}). */
    record GlobalDecl(List<String> names, boolean outer, Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitGlobal(this); }
    }

    /** A statement the front end recognized but does not model. */
    record Unsupported(String construct, Origin origin) implements Stmt {
        public <R> R accept(Visitor<R> v) { return v.visitUnsupported(this); }
    }
}
