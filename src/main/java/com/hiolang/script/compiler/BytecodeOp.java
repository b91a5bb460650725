package com.hiolang.script.compiler;

import java.util.Objects;

import com.hiolang.script.parser.Value;

/**
 * One instruction. {@code constant} is set for PUSH_CONST, {@code name} for
 * CALL / globals / members, {@code arg} holds the slot, jump target or count.
 */
public final class BytecodeOp {
    /** Jump target of a forward jump that has not been backpatched yet. */
    public static final int UNPATCHED = -1;

    public final OpCode opcode;
    public final Value constant;
    public final String name;
    public final int arg;
    public final int line;

    public BytecodeOp(OpCode opcode, Value constant, String name, int arg, int line) {
        this.opcode = Objects.requireNonNull(opcode, "opcode");
        this.constant = constant;
        this.name = name;
        this.arg = arg;
        this.line = line;
    }

    public static BytecodeOp simple(OpCode opcode, int line) {
        return new BytecodeOp(opcode, null, null, 0, line);
    }

    public static BytecodeOp constant(Value v, int line) {
        return new BytecodeOp(OpCode.PUSH_CONST, v, null, 0, line);
    }

    public static BytecodeOp named(OpCode opcode, String name, int line) {
        return new BytecodeOp(opcode, null, name, 0, line);
    }

    public static BytecodeOp withArg(OpCode opcode, int arg, int line) {
        return new BytecodeOp(opcode, null, null, arg, line);
    }

    public static BytecodeOp call(String name, int argc, int line) {
        return new BytecodeOp(OpCode.CALL, null, name, argc, line);
    }

    BytecodeOp patchTarget(int target) {
        return new BytecodeOp(opcode, constant, name, target, line);
    }

    BytecodeOp rename(String newName) {
        return new BytecodeOp(opcode, constant, newName, arg, line);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BytecodeOp)) return false;
        BytecodeOp b = (BytecodeOp) o;
        return opcode == b.opcode && arg == b.arg && line == b.line
                && Objects.equals(constant, b.constant) && Objects.equals(name, b.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(opcode, constant, name, arg, line);
    }

    @Override
    public String toString() {
        switch (opcode.operand) {
            case CONST: return opcode + " " + constant;
            case NAME: return opcode + " " + name;
            case NAME_COUNT: return opcode + " " + name + " " + arg;
            case SLOT:
            case TARGET:
            case COUNT: return opcode + " " + arg;
            default: return opcode.toString();
        }
    }
}
