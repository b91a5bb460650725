package com.hiolang.script.parser;

/** Base of every error raised by the Hiolang lexer, parser and engines. */
public class HioException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final int line;

    public HioException(String message, int line) {
        super(line > 0 ? "[line " + line + "] " + message : message);
        this.line = line;
    }

    public HioException(String message, int line, Throwable cause) {
        super(line > 0 ? "[line " + line + "] " + message : message, cause);
        this.line = line;
    }

    /** Source line of the failure, or 0 when unknown. */
    public int line() {
        return line;
    }
}
