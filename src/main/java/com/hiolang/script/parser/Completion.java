package com.hiolang.script.parser;

/** How a statement finished: normally, or by return/break/continue. */
public final class Completion {

    public enum Kind { NORMAL, RETURN, BREAK, CONTINUE }

    public static final Completion NORMAL = new Completion(Kind.NORMAL, null);
    public static final Completion BREAK = new Completion(Kind.BREAK, null);
    public static final Completion CONTINUE = new Completion(Kind.CONTINUE, null);

    public final Kind kind;
    public final Value value; // only for RETURN

    private Completion(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static Completion returning(Value value) {
        return new Completion(Kind.RETURN, value);
    }

    public boolean isNormal() {
        return kind == Kind.NORMAL;
    }
}
