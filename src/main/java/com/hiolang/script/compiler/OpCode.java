package com.hiolang.script.compiler;

/** Bytecode instruction set. Stack effects are noted as (pops -> pushes). */
public enum OpCode {
    PUSH_CONST(Operand.CONST),   // (0 -> 1)
    PUSH_VOID(Operand.NONE),     // (0 -> 1)
    POP(Operand.NONE),           // (1 -> 0)

    ADD(Operand.NONE), SUB(Operand.NONE), MUL(Operand.NONE), DIV(Operand.NONE), MOD(Operand.NONE),
    EQ(Operand.NONE), NE(Operand.NONE), LT(Operand.NONE), LE(Operand.NONE), GT(Operand.NONE), GE(Operand.NONE),
    NOT(Operand.NONE), NEG(Operand.NONE),

    JUMP(Operand.TARGET),
    JUMP_IF_FALSE(Operand.TARGET), // (1 -> 0)

    CALL(Operand.NAME_COUNT),      // (argc -> 1)
    RETURN(Operand.NONE),          // (1 -> exits frame)

    GET_LOCAL(Operand.SLOT),
    SET_LOCAL(Operand.SLOT),       // (1 -> 0)
    GET_GLOBAL(Operand.NAME),
    SET_GLOBAL(Operand.NAME),      // (1 -> 0), binding must exist
    DEFINE_GLOBAL(Operand.NAME),   // (1 -> 0)

    ARRAY_CREATE(Operand.COUNT),   // (n -> 1)
    OBJECT_CREATE(Operand.COUNT),  // (2n key/value -> 1)
    INDEX(Operand.NONE),           // (2 -> 1)
    MEMBER(Operand.NAME),          // (1 -> 1)
    SET_INDEX(Operand.NONE),       // (3 -> 0)
    SET_MEMBER(Operand.NAME);      // (2 -> 0)

    /** What the instruction's operand fields carry. */
    public enum Operand { NONE, CONST, NAME, SLOT, TARGET, COUNT, NAME_COUNT }

    public final Operand operand;

    OpCode(Operand operand) {
        this.operand = operand;
    }

    public boolean isJump() {
        return operand == Operand.TARGET;
    }
}
