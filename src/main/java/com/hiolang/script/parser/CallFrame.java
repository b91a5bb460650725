package com.hiolang.script.parser;

import java.util.List;

/** One active user-function call, kept for depth limiting and diagnostics. */
public class CallFrame {
    final String functionName;
    final List<Value> arguments;
    final int line;

    CallFrame(String functionName, List<Value> arguments, int line) {
        this.functionName = functionName;
        this.arguments = arguments;
        this.line = line;
    }

    @Override
    public String toString() {
        return functionName + "/" + arguments.size() + " (line " + line + ")";
    }
}
