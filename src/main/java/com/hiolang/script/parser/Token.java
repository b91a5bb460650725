package com.hiolang.script.parser;

import java.util.Objects;

public final class Token {
    public final TokenType type;
    public final String lexeme;
    /** Decoded payload for literals (Long, Double, String, Boolean); null otherwise. */
    public final Object literal;
    public final int line;

    public Token(TokenType type, String lexeme, Object literal, int line) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.line = line;
    }

    public boolean isKeyword() {
        return type.ordinal() >= TokenType.SPACE.ordinal() && type != TokenType.EOF;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token t = (Token) o;
        return type == t.type && line == t.line && lexeme.equals(t.lexeme) && Objects.equals(literal, t.literal);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, literal, line);
    }

    @Override
    public String toString() {
        return type == TokenType.EOF ? "end of input" : "'" + lexeme + "'";
    }
}
