package com.hiolang.script;

import java.util.Map;

import com.hiolang.script.parser.Program.ExecutionMode;
import com.hiolang.script.parser.Value;

/** Outcome of one program run: which engine ran it, its result value and its final globals. */
public final class RunResult {
    private final ExecutionMode mode;
    private final Value value;
    private final Map<String, Value> globals;

    public RunResult(ExecutionMode mode, Value value, Map<String, Value> globals) {
        this.mode = mode;
        this.value = value;
        this.globals = globals;
    }

    public ExecutionMode mode() { return mode; }
    public Value value() { return value; }
    public Map<String, Value> globals() { return globals; }

    @Override
    public String toString() {
        return "RunResult{mode=" + mode + ", value=" + value + ", globals=" + globals.keySet() + "}";
    }
}
