import com.hiolang.script.HioScript;
import com.hiolang.script.RunResult;
import com.hiolang.script.compiler.Chunk;
import com.hiolang.script.parser.CompileException;
import com.hiolang.script.parser.ErrorKind;
import com.hiolang.script.parser.HioRuntimeException;
import com.hiolang.script.parser.LexException;
import com.hiolang.script.parser.ParseException;
import com.hiolang.script.parser.Program;
import com.hiolang.script.parser.Value;
import com.hiolang.script.library.HioLibrary;
import com.hiolang.script.library.LibraryFunction;
import com.hiolang.script.library.LibraryRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HioScriptTest {

    private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
    private final HioScript es = new HioScript(new PrintStream(buf, true, StandardCharsets.UTF_8));

    private String output() {
        return buf.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    @Test
    void execute_defaultsToInterpreter() {
        RunResult r = es.execute("let a = 2;\na * 3;");
        assertEquals(Program.ExecutionMode.INTERPRETED, r.mode());
        assertEquals(Value.integer(6), r.value());
        assertEquals(Value.integer(2), r.globals().get("a"));
    }

    @Test
    void execute_subpubSelectsCompiler() {
        RunResult r = es.execute("subpub; { let a = 2; print(a); }\na + 1;");
        assertEquals(Program.ExecutionMode.COMPILED, r.mode());
        assertEquals(Value.integer(3), r.value());
        assertEquals("2\n", output());
    }

    @Test
    void execute_pubSelectsInterpreter() {
        RunResult r = es.execute("pub; { com \"main\" { print(\"p\"); } } ->\nsubpub; { print(\"s\"); }");
        assertEquals(Program.ExecutionMode.INTERPRETED, r.mode());
        assertEquals("p\ns\n", output());
    }

    @Test
    void run_globalsAreASnapshot() {
        Map<String, Value> env = es.run("let a = 1;");
        assertThrows(UnsupportedOperationException.class, () -> env.put("b", Value.integer(2)));
    }

    @Test
    void stageErrors_keepTheirTypes() {
        assertThrows(LexException.class, () -> es.run("let a = 1 & 2;"));
        assertThrows(ParseException.class, () -> es.run("let = 1;"));
        assertThrows(ParseException.class, () -> es.compile("if (x { }"));
        assertEquals(ErrorKind.UNDEFINED_FUNCTION,
                assertThrows(CompileException.class, () -> es.compile("nope();")).kind());
        assertEquals(ErrorKind.UNDEFINED_FUNCTION,
                assertThrows(HioRuntimeException.class, () -> es.interpret("nope();")).kind());
    }

    @Test
    void undefinedFunction_inUntakenBranch_onlyFailsCompilation() {
        String src = "if (false) { nope(); }\nlet ok = 1;";
        assertEquals(Value.integer(1), es.run(src).get("ok"));
        assertThrows(CompileException.class, () -> es.compile(src));
    }

    @Test
    void registeredFunction_visibleToBothEngines() {
        es.registerFunction("host.twice", args -> Value.integer(args.get(0).asInteger() * 2));
        assertEquals(Value.integer(8), es.eval("host.twice(4);"));
        assertEquals(Value.integer(8), es.compileAndRun("host.twice(4);").value());
    }

    @Test
    void customLibraryRegistry_isUsed() {
        LibraryRegistry reg = new LibraryRegistry();
        reg.register(new HioLibrary("native", "1.0.0", "test", "C")
                .addFunction(new LibraryFunction("f", Collections.singletonList("x"), "number", "C", "")));
        es.setLibraryRegistry(reg);
        assertEquals(ErrorKind.UNBOUND_LIBRARY_FUNCTION,
                assertThrows(HioRuntimeException.class, () -> es.eval("native.f(1);")).kind());
        assertEquals(ErrorKind.UNDEFINED_FUNCTION,
                assertThrows(HioRuntimeException.class, () -> es.eval("stdlib_c.strlen(\"a\");")).kind());
    }

    @Test
    void compile_thenRunCompiledTwice() {
        Chunk chunk = es.compile("let n = 0;\nfor (let i = 0; i < 3; i = i + 1) { n = n + i; }\nn;");
        assertEquals(Value.integer(3), es.runCompiled(chunk).value());
        assertEquals(Value.integer(3), es.runCompiled(chunk).value());
    }

    @Test
    void maxCallDepth_appliesToBothEngines() {
        es.setMaxCallDepth(5);
        assertEquals(5, es.getMaxCallDepth());
        String src = "function d(n) { if (n == 0) { return 0; } return d(n - 1); }\nd(10);";
        assertEquals(ErrorKind.CALL_DEPTH_EXCEEDED,
                assertThrows(HioRuntimeException.class, () -> es.eval(src)).kind());
        assertEquals(ErrorKind.CALL_DEPTH_EXCEEDED,
                assertThrows(HioRuntimeException.class, () -> es.compileAndRun(src)).kind());
        assertEquals(Value.integer(0), es.eval("function d(n) { if (n == 0) { return 0; } return d(n - 1); }\nd(4);"));
    }

    @Test
    void setOutput_redirectsPrint() {
        ByteArrayOutputStream other = new ByteArrayOutputStream();
        es.setOutput(new PrintStream(other, true, StandardCharsets.UTF_8));
        es.run("print(\"elsewhere\");");
        assertEquals("", output());
        assertEquals("elsewhere", other.toString(StandardCharsets.UTF_8).trim());
    }

    @Test
    void session_keepsStateAcrossLines() {
        HioScript.Session s = es.newSession();
        assertTrue(s.eval("let x = 2;").isVoid());
        s.eval("function twice(v) { return v * 2; }");
        assertEquals(Value.integer(4), s.eval("twice(x);"));
        assertThrows(HioRuntimeException.class, () -> s.eval("missing;"));
        assertEquals(Value.integer(3), s.eval("x + 1;"));
        assertEquals(Value.integer(2), s.globals().get("x"));
    }

    @Test
    void session_recoversAfterErrorInsideBlock() {
        HioScript.Session s = es.newSession();
        assertThrows(HioRuntimeException.class, () -> s.eval("{ let inner = 1; let bad = 1 / 0; }"));
        assertThrows(HioRuntimeException.class, () -> s.eval("inner;"));
        assertTrue(s.eval("let y = 1;").isVoid());
        assertTrue(s.globals().containsKey("y"));
    }
}
