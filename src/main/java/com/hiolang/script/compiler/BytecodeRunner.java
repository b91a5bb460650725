package com.hiolang.script.compiler;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hiolang.debug.Debug;
import com.hiolang.script.HioScript.BuiltinFunction;
import com.hiolang.script.library.LibraryFunction;
import com.hiolang.script.library.LibraryRegistry;
import com.hiolang.script.parser.Builtins;
import com.hiolang.script.parser.ErrorKind;
import com.hiolang.script.parser.HioRuntimeException;
import com.hiolang.script.parser.Interpreter;
import com.hiolang.script.parser.Operators;
import com.hiolang.script.parser.Value;

/**
 * Stack machine for compiled {@link Chunk}s. Each user-function call gets a
 * fresh slot frame sized to the callee's slot count.
 */
public class BytecodeRunner {
    private static final String TAG = "hio.vm";

    private final Map<String, Value> globals;
    private final Builtins builtins;
    private final LibraryRegistry libraries;
    private final int maxDepth;

    private Map<String, Chunk> functions = new LinkedHashMap<>();
    private int depth = 0;

    public BytecodeRunner(Map<String, Value> globals, Builtins builtins, LibraryRegistry libraries, int maxDepth) {
        this.globals = globals;
        this.builtins = builtins;
        this.libraries = libraries;
        this.maxDepth = maxDepth;
    }

    public Map<String, Value> globals() {
        return globals;
    }

    /** Runs the main chunk and returns the program result. */
    public Value run(Chunk main) {
        functions = main.functions();
        depth = 0;
        if (Debug.get().enabled()) {
            Debug.get().d(TAG, "run " + main.name() + ": " + main.size() + " ops, " + functions.size() + " functions");
        }
        return execute(main, new Value[main.slotCount()]);
    }

    private Value execute(Chunk chunk, Value[] slots) {
        List<BytecodeOp> code = chunk.ops();
        Value[] stack = new Value[16];
        int sp = 0;
        int pc = 0;

        while (pc < code.size()) {
            BytecodeOp op = code.get(pc++);
            int line = op.line;

            if (sp + 2 >= stack.length) stack = Arrays.copyOf(stack, stack.length * 2);

            switch (op.opcode) {
                // --- Constants & stack ---
                case PUSH_CONST:
                    stack[sp++] = op.constant;
                    break;
                case PUSH_VOID:
                    stack[sp++] = Value.voidValue();
                    break;
                case POP:
                    sp--;
                    break;

                // --- Arithmetic ---
                case ADD: sp--; stack[sp - 1] = Operators.add(stack[sp - 1], stack[sp], line); break;
                case SUB: sp--; stack[sp - 1] = Operators.subtract(stack[sp - 1], stack[sp], line); break;
                case MUL: sp--; stack[sp - 1] = Operators.multiply(stack[sp - 1], stack[sp], line); break;
                case DIV: sp--; stack[sp - 1] = Operators.divide(stack[sp - 1], stack[sp], line); break;
                case MOD: sp--; stack[sp - 1] = Operators.modulo(stack[sp - 1], stack[sp], line); break;
                case NEG: stack[sp - 1] = Operators.negate(stack[sp - 1], line); break;
                case NOT: stack[sp - 1] = Operators.not(stack[sp - 1]); break;

                // --- Comparison ---
                case EQ: sp--; stack[sp - 1] = Value.bool(Operators.equal(stack[sp - 1], stack[sp])); break;
                case NE: sp--; stack[sp - 1] = Value.bool(!Operators.equal(stack[sp - 1], stack[sp])); break;
                case LT: sp--; stack[sp - 1] = Operators.compare("<", stack[sp - 1], stack[sp], line); break;
                case LE: sp--; stack[sp - 1] = Operators.compare("<=", stack[sp - 1], stack[sp], line); break;
                case GT: sp--; stack[sp - 1] = Operators.compare(">", stack[sp - 1], stack[sp], line); break;
                case GE: sp--; stack[sp - 1] = Operators.compare(">=", stack[sp - 1], stack[sp], line); break;

                // --- Control flow ---
                case JUMP:
                    pc = op.arg;
                    break;
                case JUMP_IF_FALSE:
                    if (!stack[--sp].isTruthy()) pc = op.arg;
                    break;
                case RETURN:
                    return stack[sp - 1];

                case CALL: {
                    int argc = op.arg;
                    List<Value> args = new ArrayList<>(argc);
                    for (int i = sp - argc; i < sp; i++) args.add(stack[i]);
                    sp -= argc;
                    stack[sp++] = call(op.name, args, line);
                    break;
                }

                // --- Variables ---
                case GET_LOCAL:
                    stack[sp++] = slots[op.arg];
                    break;
                case SET_LOCAL:
                    slots[op.arg] = stack[--sp];
                    break;
                case GET_GLOBAL: {
                    Value v = globals.get(op.name);
                    if (v == null) {
                        throw new HioRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + op.name + "'", line);
                    }
                    stack[sp++] = v;
                    break;
                }
                case SET_GLOBAL:
                    if (!globals.containsKey(op.name)) {
                        throw new HioRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + op.name + "'", line);
                    }
                    globals.put(op.name, stack[--sp]);
                    break;
                case DEFINE_GLOBAL:
                    globals.put(op.name, stack[--sp]);
                    break;

                // --- Containers ---
                case ARRAY_CREATE: {
                    int n = op.arg;
                    List<Value> items = new ArrayList<>(n);
                    for (int i = sp - n; i < sp; i++) items.add(stack[i]);
                    sp -= n;
                    stack[sp++] = Value.array(items);
                    break;
                }
                case OBJECT_CREATE: {
                    int n = op.arg;
                    Map<String, Value> entries = new LinkedHashMap<>();
                    for (int i = sp - 2 * n; i < sp; i += 2) entries.put(stack[i].asText(), stack[i + 1]);
                    sp -= 2 * n;
                    stack[sp++] = Value.object(entries);
                    break;
                }
                case INDEX:
                    sp--;
                    stack[sp - 1] = Operators.index(stack[sp - 1], stack[sp], line);
                    break;
                case MEMBER:
                    stack[sp - 1] = Operators.member(stack[sp - 1], op.name, line);
                    break;
                case SET_INDEX:
                    sp -= 3;
                    Operators.setIndex(stack[sp], stack[sp + 1], stack[sp + 2], line);
                    break;
                case SET_MEMBER:
                    sp -= 2;
                    Operators.setMember(stack[sp], op.name, stack[sp + 1], line);
                    break;

                default:
                    throw new IllegalStateException("Unknown opcode " + op.opcode);
            }
        }
        throw new IllegalStateException("Chunk " + chunk.name() + " ended without RETURN");
    }

    private Value call(String name, List<Value> args, int line) {
        Chunk fn = functions.get(name);
        if (fn != null) return callUser(fn, args, line);

        BuiltinFunction builtin = builtins.get(name);
        if (builtin != null) return Builtins.call(name, builtin, args, line);

        if (libraries != null) {
            LibraryFunction lf = libraries.lookupPath(name);
            if (lf != null) throw Interpreter.unboundLibraryCall(name, lf, args.size(), line);
        }
        throw new HioRuntimeException(ErrorKind.UNDEFINED_FUNCTION, "Undefined function '" + name + "'", line);
    }

    private Value callUser(Chunk fn, List<Value> args, int line) {
        if (depth >= maxDepth) {
            throw new HioRuntimeException(ErrorKind.CALL_DEPTH_EXCEEDED,
                    "Maximum call depth of " + maxDepth + " exceeded calling " + fn.name(), line);
        }
        if (args.size() != fn.arity()) {
            throw new HioRuntimeException(ErrorKind.ARITY_MISMATCH,
                    fn.name() + "() expects " + fn.arity() + " arguments, got " + args.size(), line);
        }
        if (Debug.get().enabled()) {
            Debug.get().t(TAG, "call " + fn.name() + " depth=" + (depth + 1));
        }

        Value[] frame = new Value[Math.max(fn.slotCount(), args.size())];
        for (int i = 0; i < args.size(); i++) frame[i] = args.get(i);

        depth++;
        try {
            return execute(fn, frame);
        } finally {
            depth--;
        }
    }
}
