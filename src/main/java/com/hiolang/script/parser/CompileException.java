package com.hiolang.script.parser;

/** Raised by the bytecode compiler for failures it can detect statically. */
public class CompileException extends HioException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public CompileException(ErrorKind kind, String message, int line) {
        super(message, line);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
