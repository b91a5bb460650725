package com.hiolang.script.parser;

public class LexException extends HioException {
    private static final long serialVersionUID = 1L;

    public LexException(String message, int line) {
        super(message, line);
    }
}
