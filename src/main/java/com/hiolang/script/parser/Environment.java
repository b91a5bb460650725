package com.hiolang.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interpreter variable storage: one global map plus a stack of local scopes.
 *
 * The local stack is split into call frames. Lookups inside a frame walk its
 * scopes innermost first, stop at the frame base, then fall back to globals,
 * so a callee never sees its caller's locals.
 */
public class Environment {
    private final Map<String, Value> globals;

    // index 0 = outermost
    private final List<Map<String, Value>> scopes = new ArrayList<>();
    private final Deque<Integer> savedBases = new ArrayDeque<>();
    private int frameBase = 0;

    public Environment() {
        this(new LinkedHashMap<String, Value>());
    }

    public Environment(Map<String, Value> globals) {
        this.globals = globals;
    }

    public Map<String, Value> globals() {
        return globals;
    }

    // -------------------------
    // Block-scoping (LIFO)
    // -------------------------
    public void pushScope() {
        scopes.add(new LinkedHashMap<>());
    }

    public void popScope() {
        if (scopes.size() <= frameBase) {
            throw new IllegalStateException("Cannot pop past the current call frame");
        }
        scopes.remove(scopes.size() - 1);
    }

    /** Opens a call frame with one fresh scope for the parameters. */
    public void pushFrame() {
        savedBases.push(frameBase);
        frameBase = scopes.size();
        pushScope();
    }

    /** Discards every scope of the current frame, however the call exited. */
    public void popFrame() {
        if (savedBases.isEmpty()) {
            throw new IllegalStateException("No call frame to pop");
        }
        while (scopes.size() > frameBase) {
            scopes.remove(scopes.size() - 1);
        }
        frameBase = savedBases.pop();
    }

    public void clearLocals() {
        scopes.clear();
        savedBases.clear();
        frameBase = 0;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Binds in the innermost scope, or globally when no local scope is open. Overwrites. */
    public void define(String name, Value value) {
        if (scopes.size() > frameBase) {
            scopes.get(scopes.size() - 1).put(name, value);
        } else {
            globals.put(name, value);
        }
    }

    public Value get(String name, int line) {
        Map<String, Value> scope = findScope(name);
        if (scope == null) {
            throw new HioRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", line);
        }
        return scope.get(name);
    }

    /** Updates the nearest existing binding. */
    public void assign(String name, Value value, int line) {
        Map<String, Value> scope = findScope(name);
        if (scope == null) {
            throw new HioRuntimeException(ErrorKind.UNDEFINED_VARIABLE, "Undefined variable '" + name + "'", line);
        }
        scope.put(name, value);
    }

    private Map<String, Value> findScope(String name) {
        for (int i = scopes.size() - 1; i >= frameBase; i--) {
            Map<String, Value> s = scopes.get(i);
            if (s.containsKey(name)) return s;
        }
        return globals.containsKey(name) ? globals : null;
    }
}
