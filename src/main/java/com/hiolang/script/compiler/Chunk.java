package com.hiolang.script.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hiolang.script.parser.CompileException;
import com.hiolang.script.parser.ErrorKind;

/**
 * Compiled code for the main program or one function. The main chunk also
 * owns the function table (qualified name to chunk).
 */
public final class Chunk {
    private final String name;
    private final int arity;
    private final List<BytecodeOp> ops = new ArrayList<>();
    private final Map<String, Chunk> functions = new LinkedHashMap<>();
    private int slotCount;

    public Chunk(String name, int arity) {
        this.name = name;
        this.arity = arity;
    }

    public String name() { return name; }
    public int arity() { return arity; }
    public int slotCount() { return slotCount; }
    public int size() { return ops.size(); }
    public BytecodeOp op(int index) { return ops.get(index); }
    public List<BytecodeOp> ops() { return Collections.unmodifiableList(ops); }
    public Map<String, Chunk> functions() { return Collections.unmodifiableMap(functions); }

    /** Appends and returns the op's position. */
    public int emit(BytecodeOp op) {
        ops.add(op);
        return ops.size() - 1;
    }

    void patchTarget(int position, int target) {
        ops.set(position, ops.get(position).patchTarget(target));
    }

    void renameCall(int position, String resolved) {
        ops.set(position, ops.get(position).rename(resolved));
    }

    public void setSlotCount(int slotCount) {
        this.slotCount = slotCount;
    }

    public void addFunction(String qualifiedName, Chunk fn) {
        functions.put(qualifiedName, fn);
    }

    /**
     * Checks that every jump lands inside this chunk, recursing into the
     * function table.
     *
     * @throws CompileException with {@link ErrorKind#UNRESOLVED_JUMP}
     */
    public Chunk verify() {
        for (int i = 0; i < ops.size(); i++) {
            BytecodeOp op = ops.get(i);
            if (op.opcode.isJump() && (op.arg < 0 || op.arg >= ops.size())) {
                throw new CompileException(ErrorKind.UNRESOLVED_JUMP,
                        "Jump at " + name + ":" + i + " has invalid target " + op.arg, op.line);
            }
        }
        for (Chunk fn : functions.values()) fn.verify();
        return this;
    }

    /** Human-readable listing, used by the CLI's --disassemble flag and in tests. */
    public String disassemble() {
        StringBuilder sb = new StringBuilder();
        sb.append("== ").append(name).append(" (arity ").append(arity)
          .append(", slots ").append(slotCount).append(") ==\n");
        for (int i = 0; i < ops.size(); i++) {
            sb.append(String.format("%04d  %s%n", i, ops.get(i)));
        }
        for (Chunk fn : functions.values()) sb.append(fn.disassemble());
        return sb.toString();
    }
}
