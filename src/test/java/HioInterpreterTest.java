import com.hiolang.script.HioScript;
import com.hiolang.script.parser.ErrorKind;
import com.hiolang.script.parser.HioRuntimeException;
import com.hiolang.script.parser.Value;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HioInterpreterTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final HioScript es = new HioScript(new PrintStream(buf, true, StandardCharsets.UTF_8));

    private static Value v(Map<String, Value> env, String name) {
        Value val = env.get(name);
        assertNotNull(val, "Missing var: " + name);
        return val;
    }

    private String output() {
        return buf.toString(StandardCharsets.UTF_8);
    }

    private ErrorKind failureKind(String src) {
        return assertThrows(HioRuntimeException.class, () -> es.run(src)).kind();
    }

    @Test
    void letAndAssignment_number() {
        Map<String, Value> env = es.run("let x = 10;\nx = x + 5;\n");
        assertEquals(Value.Type.INTEGER, v(env, "x").getType());
        assertEquals(15L, v(env, "x").asInteger());
    }

    @Test
    void blockScope_shadowsAndRestores() {
        String src = String.join("\n",
                "let x = 10;",
                "let inner = 0;",
                "{",
                "  let x = 20;",
                "  inner = x;",
                "}",
                "let outer = x;"
        );
        Map<String, Value> env = es.run(src);
        assertEquals(20L, v(env, "inner").asInteger());
        assertEquals(10L, v(env, "outer").asInteger());
    }

    @Test
    void blockLocals_areNotGlobals() {
        Map<String, Value> env = es.run("if (true) { let hidden = 1; }\nlet seen = 2;");
        assertFalse(env.containsKey("hidden"));
        assertEquals(2L, v(env, "seen").asInteger());
    }

    @Test
    void recursion_factorial() {
        String src = String.join("\n",
                "function fact(n) {",
                "  if (n <= 1) { return 1; }",
                "  return n * fact(n - 1);",
                "}",
                "let r = fact(5);"
        );
        assertEquals(120L, v(es.run(src), "r").asInteger());
    }

    @Test
    void while_continueAndBreak() {
        String src = String.join("\n",
                "let i = 0;",
                "while (true) {",
                "  i = i + 1;",
                "  if (i >= 5) { break; }",
                "  if (i % 2 == 0) { continue; }",
                "  print(i);",
                "}"
        );
        Map<String, Value> env = es.run(src);
        assertEquals("1\n3\n", output().replace("\r\n", "\n"));
        assertEquals(5L, v(env, "i").asInteger());
    }

    @Test
    void for_sumWithContinue() {
        String src = String.join("\n",
                "let sum = 0;",
                "for (let i = 0; i < 10; i = i + 1) {",
                "  if (i == 3) { continue; }",
                "  sum = sum + i;",
                "}"
        );
        Map<String, Value> env = es.run(src);
        assertEquals(42L, v(env, "sum").asInteger());
        assertFalse(env.containsKey("i"));
    }

    @Test
    void truthiness_acrossTypes() {
        String src = String.join("\n",
                "let t = 0;",
                "if (1) { t = t + 1; }",
                "if (0) { t = t + 100; }",
                "if (\"x\") { t = t + 1; }",
                "if (\"\") { t = t + 100; }",
                "if ([0]) { t = t + 1; }",
                "if ([]) { t = t + 100; }",
                "if ({}) { t = t + 100; }",
                "if (0.5) { t = t + 1; }",
                "let n = !0;"
        );
        Map<String, Value> env = es.run(src);
        assertEquals(4L, v(env, "t").asInteger());
        assertTrue(v(env, "n").asBool());
    }

    @Test
    void logical_shortCircuits() {
        Map<String, Value> env = es.run("let a = true || missing(1);\nlet b = false && missing(1);\nlet c = 1 && \"s\";");
        assertTrue(v(env, "a").asBool());
        assertFalse(v(env, "b").asBool());
        assertEquals(Value.bool(true), v(env, "c"));
    }

    @Test
    void arithmetic_mixedTypes() {
        Map<String, Value> env = es.run(String.join("\n",
                "let a = 7 / 2;",
                "let b = 7 % 3;",
                "let c = 1 + 2.5;",
                "let d = \"n=\" + 3;",
                "let e = \"f=\" + 2.0;",
                "let f = 1 == 1.0;",
                "let g = [1, [2]] == [1.0, [2]];",
                "let h = \"abc\" < \"abd\";"
        ));
        assertEquals(3L, v(env, "a").asInteger());
        assertEquals(1L, v(env, "b").asInteger());
        assertEquals(Value.Type.FLOAT, v(env, "c").getType());
        assertEquals(3.5, v(env, "c").asFloat(), 0.0);
        assertEquals("n=3", v(env, "d").asText());
        assertEquals("f=2", v(env, "e").asText());
        assertTrue(v(env, "f").asBool());
        assertTrue(v(env, "g").asBool());
        assertTrue(v(env, "h").asBool());
    }

    @Test
    void arrays_indexAppendAndLen() {
        Map<String, Value> env = es.run(String.join("\n",
                "let a = [1, 2];",
                "a[0] = 10;",
                "a[2] = 3;",
                "let n = len(a);",
                "let first = a[0];"
        ));
        assertEquals(3L, v(env, "n").asInteger());
        assertEquals(10L, v(env, "first").asInteger());
        assertEquals(Arrays.asList(Value.integer(10), Value.integer(2), Value.integer(3)), v(env, "a").asArray());
    }

    @Test
    void arrays_outOfBounds() {
        HioRuntimeException ex = assertThrows(HioRuntimeException.class, () -> es.run("let a = [1];\na[3] = 1;"));
        assertEquals(ErrorKind.INDEX_OUT_OF_BOUNDS, ex.kind());
        assertEquals(2, ex.line());
        assertTrue(ex.getMessage().contains("Index 3 out of bounds for length 1"), ex.getMessage());
        assertEquals(ErrorKind.INDEX_OUT_OF_BOUNDS, failureKind("let a = [1];\nlet b = a[-1];"));
    }

    @Test
    void objects_membersAndKeys() {
        Map<String, Value> env = es.run(String.join("\n",
                "let o = {name: \"hio\", \"v\": 1};",
                "o.v = o.v + 1;",
                "o[\"extra\"] = true;",
                "let n = len(o);",
                "let name = o[\"name\"];"
        ));
        assertEquals(3L, v(env, "n").asInteger());
        assertEquals("hio", v(env, "name").asText());
        assertEquals(2L, v(env, "o").asObject().get("v").asInteger());
        assertEquals(ErrorKind.UNDEFINED_KEY, failureKind("let o = {};\nlet x = o.missing;"));
    }

    @Test
    void text_indexesByCodePoint() {
        Map<String, Value> env = es.run("let s = \"hé😀!\";\nlet c = s[2];\nlet n = len(s);");
        assertEquals("😀", v(env, "c").asText());
        assertEquals(4L, v(env, "n").asInteger());
    }

    @Test
    void builtins_typeAndPrint() {
        Map<String, Value> env = es.run(String.join("\n",
                "let a = type(1);",
                "let b = type(1.5);",
                "let c = type(\"s\");",
                "let d = type(true);",
                "let e = type([]);",
                "let f = type({});",
                "let g = type(print(\"x\", 1, [1, 2]));",
                "writeutil.text(\"no newline\");"
        ));
        assertEquals("number", v(env, "a").asText());
        assertEquals("float", v(env, "b").asText());
        assertEquals("string", v(env, "c").asText());
        assertEquals("boolean", v(env, "d").asText());
        assertEquals("array", v(env, "e").asText());
        assertEquals("object", v(env, "f").asText());
        assertEquals("void", v(env, "g").asText());
        assertEquals("x 1 [1, 2]\nno newline", output().replace("\r\n", "\n"));
    }

    @Test
    void builtin_arityAndTypeErrors() {
        HioRuntimeException ex = assertThrows(HioRuntimeException.class, () -> es.run("let n = len(1, 2);"));
        assertEquals(ErrorKind.ARITY_MISMATCH, ex.kind());
        assertEquals(1, ex.line());
        assertEquals(ErrorKind.TYPE_MISMATCH, failureKind("let n = len(5);"));
    }

    @Test
    void hostRegisteredFunction_isCallable() {
        es.registerFunction("math.double", args -> Value.integer(args.get(0).asInteger() * 2));
        assertEquals(42L, v(es.run("let r = math.double(21);"), "r").asInteger());
    }

    @Test
    void functions_areHoisted() {
        assertEquals(9L, v(es.run("let r = sq(3);\nfunction sq(x) { return x * x; }"), "r").asInteger());
    }

    @Test
    void functions_laterDefinitionWins() {
        assertEquals(2L, v(es.run("function f() { return 1; }\nfunction f() { return 2; }\nlet r = f();"), "r").asInteger());
    }

    @Test
    void functions_seeGlobalsButNotCallerLocals() {
        String src = String.join("\n",
                "let g = 5;",
                "function readG() { return g; }",
                "function readY() { return y; }",
                "function caller() { let y = 1; return readY(); }",
                "let r = readG();"
        );
        assertEquals(5L, v(es.run(src), "r").asInteger());
        HioRuntimeException ex = assertThrows(HioRuntimeException.class, () -> es.run(src + "\ncaller();"));
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, ex.kind());
        assertTrue(ex.getMessage().contains("Undefined variable 'y'"));
    }

    @Test
    void functions_withoutReturnYieldVoid() {
        assertEquals("void", v(es.run("function f() { let a = 1; }\nlet t = type(f());"), "t").asText());
    }

    @Test
    void functions_arityMismatch() {
        HioRuntimeException ex = assertThrows(HioRuntimeException.class,
                () -> es.run("function add(a, b) { return a + b; }\nadd(1);"));
        assertEquals(ErrorKind.ARITY_MISMATCH, ex.kind());
        assertTrue(ex.getMessage().contains("add() expects 2 arguments, got 1"), ex.getMessage());
    }

    @Test
    void callDepth_isBounded() {
        es.setMaxCallDepth(16);
        HioRuntimeException ex = assertThrows(HioRuntimeException.class,
                () -> es.run("function down(n) { return down(n + 1); }\ndown(0);"));
        assertEquals(ErrorKind.CALL_DEPTH_EXCEEDED, ex.kind());
        assertTrue(ex.getMessage().contains("Maximum call depth of 16 exceeded calling down"));
    }

    @Test
    void callDepth_mustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> es.setMaxCallDepth(0));
    }

    @Test
    void spaces_qualifyFunctions() {
        String src = String.join("\n",
                "let inside = 0;",
                "space Math name {",
                "  function sq(x) { return x * x; }",
                "  inside = sq(3);",
                "} end make;",
                "let outside = Math.sq(4);",
                "space A { space B { function f() { return 7; } } end make; } end make;",
                "let nested = A.B.f();"
        );
        Map<String, Value> env = es.run(src);
        assertEquals(9L, v(env, "inside").asInteger());
        assertEquals(16L, v(env, "outside").asInteger());
        assertEquals(7L, v(env, "nested").asInteger());
        assertEquals(ErrorKind.UNDEFINED_FUNCTION, failureKind(src + "\nsq(2);"));
    }

    @Test
    void spaces_fallBackToGlobalFunctions() {
        String src = String.join("\n",
                "function helper() { return 1; }",
                "let r = 0;",
                "space S { function run() { return helper() + 1; } r = run(); } end make;"
        );
        assertEquals(2L, v(es.run(src), "r").asInteger());
    }

    @Test
    void libraryFunctions_areArityCheckedButUnbound() {
        HioRuntimeException unbound = assertThrows(HioRuntimeException.class, () -> es.run("stdlib_c.strlen(\"abc\");"));
        assertEquals(ErrorKind.UNBOUND_LIBRARY_FUNCTION, unbound.kind());
        assertTrue(unbound.getMessage().contains("implemented in C"));

        HioRuntimeException arity = assertThrows(HioRuntimeException.class, () -> es.run("stdlib_c.strcpy(\"a\");"));
        assertEquals(ErrorKind.ARITY_MISMATCH, arity.kind());
        assertTrue(arity.getMessage().contains("stdlib_c.strcpy() expects 2 arguments, got 1"));
    }

    @Test
    void errors_haveKinds() {
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, failureKind("let a = b;"));
        assertEquals(ErrorKind.UNDEFINED_VARIABLE, failureKind("nope = 1;"));
        assertEquals(ErrorKind.UNDEFINED_FUNCTION, failureKind("nope(1);"));
        assertEquals(ErrorKind.TYPE_MISMATCH, failureKind("let a = true - 1;"));
        assertEquals(ErrorKind.TYPE_MISMATCH, failureKind("let a = -\"s\";"));
        assertEquals(ErrorKind.TYPE_MISMATCH, failureKind("let a = [1] < [2];"));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, failureKind("let a = 1 / 0;"));
        assertEquals(ErrorKind.DIVISION_BY_ZERO, failureKind("let a = 1.5 % 0.0;"));
        assertEquals(ErrorKind.INVALID_CALL_TARGET, failureKind("[1][0]();"));
    }

    @Test
    void errors_carryLineNumbers() {
        HioRuntimeException ex = assertThrows(HioRuntimeException.class, () -> es.run("let a = 1;\n\nlet b = a / 0;"));
        assertEquals(3, ex.line());
        assertEquals("[line 3] Division by zero", ex.getMessage());
    }

    @Test
    void eval_returnsLastExpressionOrTopLevelReturn() {
        assertEquals(Value.integer(7), es.eval("let a = 3;\na + 4;"));
        assertTrue(es.eval("let a = 3;").isVoid());
        assertEquals(Value.integer(1), es.eval("return 1;\nprint(\"unreached\");"));
        assertEquals("", output());
    }

    @Test
    void run_entryFunction() {
        Value r = es.run("function add(a, b) { return a + b; }", "add",
                Arrays.asList(Value.integer(2), Value.integer(3)));
        assertEquals(5L, r.asInteger());
    }

    @Test
    void hostFunctionError_getsCallSiteLine_andKeepsCause() {
        HioRuntimeException original = new HioRuntimeException(ErrorKind.TYPE_MISMATCH, "bad input");
        es.registerFunction("boom", args -> { throw original; });

        HioRuntimeException ex = assertThrows(HioRuntimeException.class, () -> es.run("let a = 1;\nboom();"));
        assertEquals(2, ex.line());
        assertEquals(ErrorKind.TYPE_MISMATCH, ex.kind());
        assertEquals("[line 2] bad input", ex.getMessage());
        assertSame(original, ex.getCause());
    }
}
