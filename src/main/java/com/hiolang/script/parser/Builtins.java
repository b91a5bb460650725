package com.hiolang.script.parser;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.hiolang.script.HioScript.BuiltinFunction;

/**
 * Host functions callable from scripts: print, len, type, writeutil.text, plus
 * whatever the host registers. Names may be qualified ("ns.fn").
 */
public class Builtins {
    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<>();
    private PrintStream out;

    public Builtins() {
        this(System.out);
    }

    public Builtins(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
        installDefaults();
    }

    private void installDefaults() {
        functions.put("print", args -> {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(args.get(i).display());
            }
            out.println(sb);
            return Value.voidValue();
        });

        functions.put("len", args -> {
            requireArity("len", args, 1);
            Value v = args.get(0);
            switch (v.type) {
                case TEXT: {
                    String s = v.asText();
                    return Value.integer(s.codePointCount(0, s.length()));
                }
                case ARRAY: return Value.integer(v.asArray().size());
                case OBJECT: return Value.integer(v.asObject().size());
                default:
                    throw new HioRuntimeException(ErrorKind.TYPE_MISMATCH,
                            "len() expects a string, array or object, got " + v.typeName());
            }
        });

        functions.put("type", args -> {
            requireArity("type", args, 1);
            return Value.text(args.get(0).typeName());
        });

        functions.put("writeutil.text", args -> {
            requireArity("writeutil.text", args, 1);
            out.print(args.get(0).display());
            out.flush();
            return Value.voidValue();
        });
    }

    public static void requireArity(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new HioRuntimeException(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + expected + " argument" + (expected == 1 ? "" : "s") + ", got " + args.size());
        }
    }

    /** Invokes {@code fn}, attaching the call-site line to errors raised without one. */
    public static Value call(String name, BuiltinFunction fn, List<Value> args, int line) {
        Value result;
        try {
            result = fn.call(args);
        } catch (HioRuntimeException e) {
            if (e.line() > 0 || line <= 0) throw e;
            throw new HioRuntimeException(e.kind(), e.getMessage(), line, e);
        }
        return result == null ? Value.voidValue() : result;
    }

    public void register(String name, BuiltinFunction fn) {
        functions.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(fn, "fn"));
    }

    public BuiltinFunction get(String name) {
        return functions.get(name);
    }

    public boolean has(String name) {
        return functions.containsKey(name);
    }

    public void setOutput(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }
}
