package com.hiolang.script;

import java.io.PrintStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import com.hiolang.debug.Debug;
import com.hiolang.script.compiler.BytecodeRunner;
import com.hiolang.script.compiler.Chunk;
import com.hiolang.script.compiler.Compiler;
import com.hiolang.script.library.LibraryRegistry;
import com.hiolang.script.library.StandardLibraries;
import com.hiolang.script.parser.Builtins;
import com.hiolang.script.parser.Environment;
import com.hiolang.script.parser.HioException;
import com.hiolang.script.parser.Interpreter;
import com.hiolang.script.parser.Parser;
import com.hiolang.script.parser.Program;
import com.hiolang.script.parser.Program.ExecutionMode;
import com.hiolang.script.parser.Value;

/**
 * Core Hiolang engine.
 *
 * - C-like syntax (let / if / else / while / for / && / || / == / != / + - * / %)
 * - Types: number (64-bit integer), float, string, boolean, array, object, void
 * - Two engines over one AST: a tree-walking interpreter and a bytecode compiler + runner
 * - Namespaces ("space ... end make;") and section markers (pub = interpreted, subpub = compiled)
 * - Function calls:
 *     - Built-ins (print, len, type, writeutil.text, and anything registered via registerFunction)
 *     - User-defined functions (function name(a, b) { ...; return ...; })
 *     - Foreign library signatures from the {@link LibraryRegistry} (arity-checked, never invoked)
 *
 * Every run builds a fresh interpreter or runner; configuration lives here.
 */
public class HioScript {
    public static final String VERSION = "0.1.0";
    public static final int DEFAULT_MAX_CALL_DEPTH = 256;

    private static final String TAG = "hio.script";

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Builtins builtins;
    private LibraryRegistry libraries = StandardLibraries.newRegistry();
    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

    public HioScript() {
        this(System.out);
    }

    public HioScript(PrintStream out) {
        this.builtins = new Builtins(out);
    }

    // ===================== CONFIGURATION =====================

    public void setMaxCallDepth(int depth) {
        if (depth < 1) throw new IllegalArgumentException("maxCallDepth must be positive: " + depth);
        this.maxCallDepth = depth;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** Where print and writeutil.text write. */
    public void setOutput(PrintStream out) { builtins.setOutput(out); }

    public void registerFunction(String name, BuiltinFunction fn) { builtins.register(name, fn); }

    public void setLibraryRegistry(LibraryRegistry registry) {
        this.libraries = Objects.requireNonNull(registry, "registry");
    }

    public LibraryRegistry libraries() { return libraries; }

    public Builtins builtins() { return builtins; }

    // ===================== ENGINE PUBLIC API =====================

    public Program parse(String source) {
        return guarded("parse", () -> Parser.parse(source));
    }

    /** Interprets the program and returns a snapshot of its globals. */
    public Map<String, Value> run(String source) {
        return interpret(source).globals();
    }

    /** Interprets the program, then calls {@code entryFunctionName(entryArgs...)} and returns its value. */
    public Value run(String source, String entryFunctionName, List<Value> entryArgs) {
        return guarded("run", () -> {
            Program program = Parser.parse(source);
            Interpreter interpreter = newInterpreter(new Environment());
            interpreter.execute(program);
            return interpreter.invokeForHost(entryFunctionName,
                    entryArgs == null ? Collections.<Value>emptyList() : entryArgs);
        });
    }

    /** Interprets the program and returns its result value. */
    public Value eval(String source) {
        return interpret(source).value();
    }

    public RunResult interpret(String source) {
        return guarded("interpret", () -> {
            Program program = Parser.parse(source);
            Environment env = new Environment();
            Value value = newInterpreter(env).execute(program);
            return new RunResult(ExecutionMode.INTERPRETED, value, snapshot(env.globals()));
        });
    }

    public Chunk compile(String source) {
        return guarded("compile", () -> new Compiler(builtins, libraries).compile(Parser.parse(source)));
    }

    public RunResult runCompiled(Chunk chunk) {
        return guarded("exec", () -> {
            Map<String, Value> globals = new LinkedHashMap<>();
            Value value = new BytecodeRunner(globals, builtins, libraries, maxCallDepth).run(chunk);
            return new RunResult(ExecutionMode.COMPILED, value, snapshot(globals));
        });
    }

    public RunResult compileAndRun(String source) {
        return runCompiled(compile(source));
    }

    /** Runs with the engine the program's first pub/subpub section selects (interpreter by default). */
    public RunResult execute(String source) {
        Program program = parse(source);
        ExecutionMode mode = program.executionMode();
        Debug.get().d(TAG, "execution mode " + mode);
        if (mode == ExecutionMode.COMPILED) {
            return runCompiled(guarded("compile", () -> new Compiler(builtins, libraries).compile(program)));
        }
        return guarded("interpret", () -> {
            Environment env = new Environment();
            Value value = newInterpreter(env).execute(program);
            return new RunResult(ExecutionMode.INTERPRETED, value, snapshot(env.globals()));
        });
    }

    /** Interpreter state kept alive across {@link Session#eval} calls, for the REPL. */
    public Session newSession() {
        return new Session();
    }

    public final class Session {
        private final Environment env = new Environment();
        private final Interpreter interpreter = newInterpreter(env);

        private Session() {}

        public Value eval(String source) {
            try {
                return interpreter.execute(Parser.parse(source));
            } catch (HioException e) {
                env.clearLocals();
                throw e;
            }
        }

        public Map<String, Value> globals() {
            return Collections.unmodifiableMap(env.globals());
        }
    }

    // ===================== INTERNALS =====================

    private Interpreter newInterpreter(Environment env) {
        return new Interpreter(env, builtins, libraries, maxCallDepth);
    }

    private static Map<String, Value> snapshot(Map<String, Value> globals) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(globals));
    }

    private static <T> T guarded(String stage, Supplier<T> body) {
        try {
            return body.get();
        } catch (HioException e) {
            Debug.get().w(TAG, stage + " failed: " + e.getMessage(), e);
            throw e;
        }
    }
}
