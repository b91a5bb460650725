package com.hiolang.script.parser;

/** Raised by the interpreter and the bytecode runner. */
public class HioRuntimeException extends HioException {
    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public HioRuntimeException(ErrorKind kind, String message) {
        this(kind, message, 0);
    }

    public HioRuntimeException(ErrorKind kind, String message, int line) {
        super(message, line);
        this.kind = kind;
    }

    public HioRuntimeException(ErrorKind kind, String message, int line, Throwable cause) {
        super(message, line, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
