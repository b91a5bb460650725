package com.hiolang.script.parser;

public enum TokenType {
    // Single-character punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, DOT, SEMICOLON, COLON,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL,
    EQUAL, EQUAL_EQUAL,
    GREATER, GREATER_EQUAL,
    LESS, LESS_EQUAL,
    AND_AND, OR_OR,
    ARROW, DASH_ARROW,

    // Literals
    IDENTIFIER, STRING, INTEGER, FLOAT,

    // Keywords
    SPACE, END, MAKE, INSPACE, CALL, TEXT, PUB, SUBPUB,
    FUNCTION, RETURN, IF, ELSE, WHILE, FOR, BREAK, CONTINUE, LET,
    TRUE, FALSE,

    EOF
}
