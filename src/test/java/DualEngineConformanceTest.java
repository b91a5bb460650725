import com.hiolang.script.HioScript;
import com.hiolang.script.RunResult;
import com.hiolang.script.parser.ErrorKind;
import com.hiolang.script.parser.HioRuntimeException;
import com.hiolang.script.parser.Program;
import com.hiolang.script.parser.Value;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/** Every program must print the same output, produce the same result and leave the same globals in both engines. */
public class DualEngineConformanceTest {

    private static final class Outcome {
        final String output;
        final RunResult result;
        final HioRuntimeException error;

        Outcome(String output, RunResult result, HioRuntimeException error) {
            this.output = output;
            this.result = result;
            this.error = error;
        }
    }

    private static Outcome interpret(String src) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        HioScript es = new HioScript(new PrintStream(buf, true, StandardCharsets.UTF_8));
        es.setMaxCallDepth(32);
        try {
            RunResult result = es.interpret(src);
            return new Outcome(buf.toString(StandardCharsets.UTF_8), result, null);
        } catch (HioRuntimeException e) {
            return new Outcome(buf.toString(StandardCharsets.UTF_8), null, e);
        }
    }

    private static Outcome compiled(String src) {
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        HioScript es = new HioScript(new PrintStream(buf, true, StandardCharsets.UTF_8));
        es.setMaxCallDepth(32);
        try {
            RunResult result = es.compileAndRun(src);
            return new Outcome(buf.toString(StandardCharsets.UTF_8), result, null);
        } catch (HioRuntimeException e) {
            return new Outcome(buf.toString(StandardCharsets.UTF_8), null, e);
        }
    }

    private static void assertSameBehaviour(String src) {
        Outcome a = interpret(src);
        Outcome b = compiled(src);
        assertEquals(a.output, b.output, "output of:\n" + src);
        if (a.error != null || b.error != null) {
            assertNotNull(a.error, "only the compiled run failed:\n" + src);
            assertNotNull(b.error, "only the interpreted run failed:\n" + src);
            assertEquals(a.error.kind(), b.error.kind());
            assertEquals(a.error.getMessage(), b.error.getMessage());
            return;
        }
        assertEquals(Program.ExecutionMode.INTERPRETED, a.result.mode());
        assertEquals(Program.ExecutionMode.COMPILED, b.result.mode());
        assertEquals(a.result.value(), b.result.value(), "result of:\n" + src);
        assertEquals(a.result.globals(), b.result.globals(), "globals of:\n" + src);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "let x = 1 + 2 * 3;\nx;",
            "function fact(n) { if (n <= 1) { return 1; } return n * fact(n - 1); }\nlet r = fact(10);\nr;",
            "let i = 0;\nwhile (true) { i = i + 1; if (i >= 5) { break; } if (i % 2 == 0) { continue; } print(i); }",
            "let s = \"\";\nfor (let i = 0; i < 4; i = i + 1) { if (i == 1) { s = s + \"one \"; } else if (i == 2) { continue; } else { s = s + i + \" \"; } }\ns;",
            "let a = [1, 2];\na[2] = 3;\nlet o = {k: a, \"n\": 1.5};\no.k[0] = 9;\no.m = o.n * 2;\nprint(o, len(a), a == [9, 2, 3]);",
            "space Math { function sq(x) { return x * x; } print(sq(3)); } end make;\nlet r = Math.sq(4);",
            "let t = 0;\nif ([]) { t = 1; } else if (\"\") { t = 2; } else { t = 3; }\nlet u = !t || t > 2 && 1;\nprint(t, u);",
            "let f = 7.0 / 2;\nlet g = 2.0 * 3;\nlet h = -0.5 + 1;\nprint(f, g, h, 1.0 == 1);",
            "pub; { com \"main\" { let greeting = \"hi\"; writeutil.text(greeting + \"!\"); } } ->\nlet after = type(greeting);",
            "let n = 0;\nfor (let i = 0; i < 3; i = i + 1) { for (let j = 0; j < 3; j = j + 1) { if (j == 1) { break; } n = n + 1; } }\nn;",
            "function outer() { let a = 1; { let a = 2; } return a; }\nouter();",
            "let g = 5;\nfunction bump() { g = g + 1; return g; }\nbump();\nbump();",
            "let x = 10;\n{ let x = 20; print(x); }\nprint(x);",
            "let r = 0;\nfunction first(items) { for (let i = 0; i < len(items); i = i + 1) { if (items[i] > 2) { return items[i]; } } return -1; }\nr = first([1, 5, 3]);",
            "let s = \"héllo\";\nprint(len(s), s[1], type(s[1]));",
            "return 3;\nprint(\"unreached\");",
            "let a = 1 / 0;",
            "let a = [1];\nprint(a[1]);",
            "let o = {};\nprint(\"before\");\nprint(o.missing);",
            "function down(n) { return down(n + 1); }\ndown(0);",
            "print(1);\nlet z = undefinedName + 1;",
            "stdlib_cpp.string_length(\"abc\");",
            "stdlib_cpp.string_length(\"a\", \"b\");",
            "let x = true + 1;",
            "print(len(5));",
            "function fact(n) { if (n <= 1) { return 1; } return n * fact(n - 1); }\nfact(5.0);",
            "function fact(n) { if (n <= 1) { return 1; } return n * fact(n - 1); }\nfact(\"5\");"
    })
    void enginesAgree(String src) {
        assertSameBehaviour(src);
    }

    @Test
    void factorial_promotesFloatAndRejectsText() {
        String fact = "function fact(n) { if (n <= 1) { return 1; } return n * fact(n - 1); }\n";

        for (Outcome o : new Outcome[] { interpret(fact + "fact(5.0);"), compiled(fact + "fact(5.0);") }) {
            assertNull(o.error);
            assertEquals(Value.Type.FLOAT, o.result.value().type);
            assertEquals(120.0, o.result.value().asFloat());
        }
        for (Outcome o : new Outcome[] { interpret(fact + "fact(\"5\");"), compiled(fact + "fact(\"5\");") }) {
            assertNotNull(o.error);
            assertEquals(ErrorKind.TYPE_MISMATCH, o.error.kind());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "let a = 1 / 0;",
            "function down(n) { return down(n + 1); }\ndown(0);",
            "let o = {};\nprint(o.missing);"
    })
    void errorPrograms_failInBoth(String src) {
        Outcome a = interpret(src);
        assertNotNull(a.error);
        assertNotEquals(ErrorKind.UNRESOLVED_JUMP, a.error.kind());
        assertNotNull(compiled(src).error);
    }
}
