package com.hiolang.script.parser;

public class ParseException extends HioException {
    private static final long serialVersionUID = 1L;

    private final transient Token token;

    public ParseException(Token token, String message) {
        super("at " + token + ": " + message, token.line);
        this.token = token;
    }

    /** The offending token. */
    public Token token() {
        return token;
    }
}
