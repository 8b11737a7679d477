package com.flowtrace.engine.ast.java;

import com.flowtrace.engine.ast.Expr;
import com.flowtrace.engine.ast.ParseResult;
import com.flowtrace.engine.ast.Stmt;
import com.flowtrace.engine.ast.Target;
import com.flowtrace.engine.source.SourceFile;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JavaAdapterTest {

    private final JavaAdapter adapter = new JavaAdapter();

    private Stmt.ClassDef parseClass(String source) {
        ParseResult result = adapter.parse(SourceFile.of("Sample.java", source));
        assertTrue(result.ok(), () -> "unexpected errors: " + result.errors());
        return (Stmt.ClassDef) result.statements().get(0);
    }

    private static Stmt.FunctionDef method(Stmt.ClassDef cls, String name) {
        return cls.body().stream()
                .filter(s -> s instanceof Stmt.FunctionDef f && f.name().equals(name))
                .map(s -> (Stmt.FunctionDef) s)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void fieldsComeBeforeMethods() {
        Stmt.ClassDef cls = parseClass("""
            class Counter {
                int next() { return count; }
                private int count = 0;
                private String label;
            }
            """);
        Stmt.Assign count = (Stmt.Assign) cls.body().get(0);
        assertEquals(Stmt.AssignForm.PLAIN, count.form());
        assertEquals("int", count.declaredType());
        Stmt.Assign label = (Stmt.Assign) cls.body().get(1);
        assertEquals(Stmt.AssignForm.DECLARATION, label.form());
        assertNull(label.value());
        assertInstanceOf(Stmt.FunctionDef.class, cls.body().get(2));
    }

    @Test
    void methodParametersKeepDeclaredTypes() {
        Stmt.FunctionDef m = method(parseClass("""
            class Calc {
                double scale(double value, int factor) { return value * factor; }
            }
            """), "scale");
        assertEquals(List.of("value", "factor"), m.params().stream().map(Stmt.Param::name).toList());
        assertEquals("double", m.params().get(0).declaredType());
        assertEquals("double", m.returnType());
    }

    @Test
    void constructorIsNamedInit() {
        Stmt.ClassDef cls = parseClass("""
            class Box {
                private final int size;
                Box(int size) { this.size = size; }
            }
            """);
        Stmt.FunctionDef init = method(cls, "<init>");
        Stmt.Assign write = (Stmt.Assign) init.body().get(0);
        assertEquals(new Target.AttributeTarget(new Expr.Name("this"), "size"), write.targets().get(0));
    }

    @Test
    void chainedAssignmentIsFlattened() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                void f() { int a, b; a = b = 10; }
            }
            """), "f");
        Stmt.Assign chained = (Stmt.Assign) m.body().get(2);
        assertEquals(List.of(new Target.NameTarget("a"), new Target.NameTarget("b")), chained.targets());
    }

    @Test
    void compoundAssignmentAndIncrementAreAugmented() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                void f(int x) { int total = 0; total += x; total++; }
            }
            """), "f");
        Stmt.AugAssign plus = (Stmt.AugAssign) m.body().get(1);
        assertEquals("+", plus.op());
        Stmt.AugAssign step = (Stmt.AugAssign) m.body().get(2);
        assertEquals("+", step.op());
        assertEquals(new Expr.Literal(Expr.LiteralKind.INT, "1"), step.value());
    }

    @Test
    void nestedAssignmentIsHoisted() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                void f(java.io.BufferedReader reader) throws Exception {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        System.out.println(line);
                    }
                }
            }
            """), "f");
        Stmt.Assign hoisted = (Stmt.Assign) m.body().get(1);
        assertEquals(new Target.NameTarget("line"), hoisted.targets().get(0));
        assertInstanceOf(Expr.Call.class, hoisted.value());
        Stmt.ExprStmt test = (Stmt.ExprStmt) m.body().get(2);
        assertTrue(test.origin().context().inLoop());
    }

    @Test
    void loopsAndBranchesCarryContext() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                int f(int[] xs) {
                    int sum = 0;
                    for (int x : xs) {
                        if (x > 0) {
                            sum += x;
                        }
                    }
                    return sum;
                }
            }
            """), "f");
        Stmt.Assign element = (Stmt.Assign) m.body().get(1);
        assertEquals(Stmt.AssignForm.LOOP_ELEMENT, element.form());
        assertEquals("int", element.declaredType());
        Stmt.AugAssign update = (Stmt.AugAssign) m.body().get(3);
        assertTrue(update.origin().context().inLoop());
        assertTrue(update.origin().context().inConditional());
        assertInstanceOf(Stmt.Return.class, m.body().get(4));
    }

    @Test
    void catchParameterIsBoundInHandler() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                void f() {
                    try {
                        run();
                    } catch (IllegalStateException e) {
                        log(e);
                    }
                }
            }
            """), "f");
        Stmt.Assign binding = (Stmt.Assign) m.body().get(1);
        assertEquals(Stmt.AssignForm.CATCH_BINDING, binding.form());
        assertEquals("IllegalStateException", binding.declaredType());
        assertTrue(binding.origin().context().inConditional());
    }

    @Test
    void objectCreationAndMethodCalls() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                void f() { var list = new ArrayList<String>(); list.add("x"); }
            }
            """), "f");
        Stmt.Assign created = (Stmt.Assign) m.body().get(0);
        assertEquals("ArrayList", ((Expr.New) created.value()).type());
        Expr.Call call = (Expr.Call) ((Stmt.ExprStmt) m.body().get(1)).expr();
        assertEquals("add", call.calleeName());
        assertEquals(new Expr.Name("list"), call.receiver());
    }

    @Test
    void lambdaIsUnsupported() {
        Stmt.FunctionDef m = method(parseClass("""
            class C {
                void f() { Runnable r = () -> {}; }
            }
            """), "f");
        assertInstanceOf(Expr.Unsupported.class, ((Stmt.Assign) m.body().get(0)).value());
    }

    @Test
    void syntaxErrorFailsTheFile() {
        ParseResult result = adapter.parse(SourceFile.of("Broken.java", "class Broken { void f( { }\n"));
        assertFalse(result.ok());
        assertFalse(result.errors().isEmpty());
        assertEquals("Broken.java", result.errors().get(0).file());
    }
}
