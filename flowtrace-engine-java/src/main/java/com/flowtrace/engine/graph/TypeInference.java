package com.flowtrace.engine.graph;

import com.flowtrace.engine.ast.Expr;
import com.flowtrace.engine.source.Language;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Syntactic type inference for one assigned value: literal kinds, known constructors, casts and
 * declared types. Anything else is {@link InferredType#UNKNOWN}.
 */
public final class TypeInference {

    private static final Set<String> PYTHON_CONSTRUCTORS = Set.of(
        "int", "float", "str", "bool", "list", "dict", "set", "tuple", "bytes", "frozenset", "complex", "bytearray");

    private static final Map<String, String> PYTHON_BUILTIN_RESULTS = Map.of(
        "len", "int", "sorted", "list", "range", "range", "repr", "str", "abs", "int", "round", "int");

    private static final Set<String> COMPARISONS = Set.of(
        "<", ">", "==", ">=", "<=", "!=", "in", "not in", "is", "is not", "instanceof");

    private static final List<String> JAVA_NUMERIC = List.of("byte", "short", "char", "int", "long", "float", "double");

    private final Language language;
    private final Function<String, InferredType> names;

    /**
     * @param names type of the currently visible version of a name
     */
    public TypeInference(Language language, Function<String, InferredType> names) {
        this.language = language;
        this.names = names;
    }

    /** Declared type wins when present; otherwise the value decides. */
    public InferredType infer(Expr value, String declaredType) {
        boolean nullValue = value instanceof Expr.Literal l && l.kind() == Expr.LiteralKind.NULL;
        if (declaredType != null && !declaredType.isBlank() && !declaredType.equals("var")) {
            return new InferredType.Known(declaredType, nullValue || isOptional(declaredType));
        }
        return value == null ? InferredType.UNKNOWN : infer(value);
    }

    public InferredType declared(String declaredType) {
        if (declaredType == null || declaredType.isBlank() || declaredType.equals("var")) return InferredType.UNKNOWN;
        return new InferredType.Known(declaredType, isOptional(declaredType));
    }

    public InferredType infer(Expr value) {
        if (value instanceof Expr.Literal l) return literal(l);
        if (value instanceof Expr.Name n) return names.apply(n.id());
        if (value instanceof Expr.Container c) return container(c.kind());
        if (value instanceof Expr.Comprehension c) return container(c.kind());
        if (value instanceof Expr.FormattedString) return known(python() ? "str" : "String");
        if (value instanceof Expr.New n) return known(n.type());
        if (value instanceof Expr.Cast c) return known(c.type());
        if (value instanceof Expr.Call c) return call(c);
        if (value instanceof Expr.Unary u) {
            if (u.op().equals("not") || u.op().equals("!")) return known(python() ? "bool" : "boolean");
            if (u.op().equals("-") || u.op().equals("+") || u.op().equals("~")) return infer(u.operand());
            return InferredType.UNKNOWN;
        }
        if (value instanceof Expr.Binary b) return binary(b);
        if (value instanceof Expr.Conditional c) return conditional(c);
        return InferredType.UNKNOWN;
    }

    private InferredType literal(Expr.Literal l) {
        boolean py = python();
        return switch (l.kind()) {
            case INT -> known("int");
            case LONG -> known("long");
            case FLOAT -> known(py ? "float" : (l.text().endsWith("f") || l.text().endsWith("F") ? "float" : "double"));
            case STRING -> known(py ? "str" : "String");
            case CHAR -> known("char");
            case BOOL -> known(py ? "bool" : "boolean");
            case BYTES -> known("bytes");
            case NULL -> new InferredType.Known(py ? "NoneType" : "null", true);
            case OTHER -> InferredType.UNKNOWN;
        };
    }

    private InferredType container(Expr.ContainerKind kind) {
        return switch (kind) {
            case LIST -> known("list");
            case TUPLE -> known("tuple");
            case SET -> known("set");
            case DICT -> known("dict");
            case GENERATOR -> known("generator");
            case ARRAY, SLICE -> InferredType.UNKNOWN;
        };
    }

    private InferredType call(Expr.Call c) {
        if (!python() || !(c.callee() instanceof Expr.Name n)) return InferredType.UNKNOWN;
        String id = n.id();
        if (PYTHON_CONSTRUCTORS.contains(id)) return known(id);
        if (PYTHON_BUILTIN_RESULTS.containsKey(id)) return known(PYTHON_BUILTIN_RESULTS.get(id));
        if (!id.isEmpty() && Character.isUpperCase(id.charAt(0))) return known(id);
        return InferredType.UNKNOWN;
    }

    /** Folds a left-deep operator chain from its innermost operand outwards. */
    private InferredType binary(Expr.Binary b) {
        Deque<Expr.Binary> chain = new ArrayDeque<>();
        Expr innermost = b;
        while (innermost instanceof Expr.Binary inner) {
            chain.push(inner);
            innermost = inner.left();
        }
        InferredType type = infer(innermost);
        while (!chain.isEmpty()) {
            Expr.Binary step = chain.pop();
            type = combine(step.op(), type, step.right());
        }
        return type;
    }

    private InferredType combine(String op, InferredType left, Expr rightOperand) {
        if (COMPARISONS.contains(op) || op.equals("&&") || op.equals("||")) {
            return known(python() ? "bool" : "boolean");
        }
        InferredType right = infer(rightOperand);
        if (op.equals("and") || op.equals("or")) {
            return left.isKnown() && left.equals(right) ? left : InferredType.UNKNOWN;
        }
        if (!left.isKnown() || !right.isKnown()) return InferredType.UNKNOWN;
        String l = left.display();
        String r = right.display();
        return python() ? pythonArithmetic(op, l, r) : javaArithmetic(op, l, r);
    }

    private InferredType pythonArithmetic(String op, String l, String r) {
        boolean numeric = isPythonNumber(l) && isPythonNumber(r);
        if (numeric) {
            if (op.equals("/")) return known("float");
            if (l.equals("float") || r.equals("float")) return known("float");
            if (l.equals("bool") && r.equals("bool") && Set.of("&", "|", "^").contains(op)) return known("bool");
            return known("int");
        }
        if (op.equals("+") && l.equals(r) && Set.of("str", "list", "tuple", "bytes").contains(l)) return known(l);
        if (op.equals("*") && Set.of("str", "list", "tuple").contains(l) && r.equals("int")) return known(l);
        if (op.equals("%") && l.equals("str")) return known("str");
        if (op.equals("|") && l.equals(r) && (l.equals("set") || l.equals("dict"))) return known(l);
        return InferredType.UNKNOWN;
    }

    private static boolean isPythonNumber(String t) {
        return t.equals("int") || t.equals("float") || t.equals("bool");
    }

    private InferredType javaArithmetic(String op, String l, String r) {
        if (op.equals("+") && (l.equals("String") || r.equals("String"))) return known("String");
        int li = JAVA_NUMERIC.indexOf(l);
        int ri = JAVA_NUMERIC.indexOf(r);
        if (li < 0 || ri < 0) {
            return l.equals(r) && l.equals("boolean") ? known("boolean") : InferredType.UNKNOWN;
        }
        return known(JAVA_NUMERIC.get(Math.max(Math.max(li, ri), JAVA_NUMERIC.indexOf("int"))));
    }

    private InferredType conditional(Expr.Conditional c) {
        InferredType a = infer(c.whenTrue());
        InferredType b = infer(c.whenFalse());
        if (!a.isKnown() || !b.isKnown()) return InferredType.UNKNOWN;
        if (a.display().equals(b.display())) return new InferredType.Known(a.display(), a.nullable() || b.nullable());
        if (isNull(a)) return new InferredType.Known(b.display(), true);
        if (isNull(b)) return new InferredType.Known(a.display(), true);
        return InferredType.UNKNOWN;
    }

    private static boolean isNull(InferredType t) {
        return t.display().equals("NoneType") || t.display().equals("null");
    }

    private static boolean isOptional(String declaredType) {
        return declaredType.startsWith("Optional[") || declaredType.contains("| None") || declaredType.contains("None |")
            || declaredType.startsWith("Optional<");
    }

    private boolean python() {
        return language == Language.PYTHON;
    }

    private static InferredType known(String name) {
        return new InferredType.Known(name, false);
    }
}
