package com.hiolang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hiolang.debug.Debug;

/**
 * Turns Hiolang source into tokens, one at a time.
 *
 * The lexer keeps only its cursor: the current position, the current line and
 * one character of lookahead. {@link #tokenize()} is a convenience that drains
 * {@link #nextToken()} into a list ending with EOF.
 */
public class Lexer {
    private static final String TAG = "hio.lexer";

    private final String source;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private boolean done = false;

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        map.put("space", TokenType.SPACE);
        map.put("end", TokenType.END);
        map.put("make", TokenType.MAKE);
        map.put("inspace", TokenType.INSPACE);
        map.put("call", TokenType.CALL);
        map.put("text", TokenType.TEXT);
        map.put("pub", TokenType.PUB);
        map.put("subpub", TokenType.SUBPUB);
        map.put("function", TokenType.FUNCTION);
        map.put("return", TokenType.RETURN);
        map.put("if", TokenType.IF);
        map.put("else", TokenType.ELSE);
        map.put("while", TokenType.WHILE);
        map.put("for", TokenType.FOR);
        map.put("break", TokenType.BREAK);
        map.put("continue", TokenType.CONTINUE);
        map.put("let", TokenType.LET);
        map.put("true", TokenType.TRUE);
        map.put("false", TokenType.FALSE);
        keywords = Collections.unmodifiableMap(map);
    }

    public Lexer(String source) {
        this.source = source;
    }

    public static boolean isKeyword(String word) {
        return keywords.containsKey(word);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token t;
        do {
            t = nextToken();
            tokens.add(t);
        } while (t.type != TokenType.EOF);
        Debug.get().t(TAG, "tokenized " + tokens.size() + " tokens, " + line + " lines");
        return tokens;
    }

    /** Returns the next token; returns EOF (repeatedly) once the input is exhausted. */
    public Token nextToken() {
        while (true) {
            skipWhitespaceAndComments();
            if (isAtEnd()) {
                done = true;
                return new Token(TokenType.EOF, "", null, line);
            }
            start = current;
            Token t = scanToken();
            if (t != null) return t;
        }
    }

    public boolean isDone() {
        return done;
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == '\n') {
                line++;
                current++;
            } else if (Character.isWhitespace(c)) {
                current++;
            } else if (c == '\'' && peekNext() == '\'') {
                // '' comment runs to end of line
                while (!isAtEnd() && peek() != '\n') current++;
            } else {
                return;
            }
        }
    }

    private Token scanToken() {
        char c = advance();
        switch (c) {
            case '(': return token(TokenType.LEFT_PAREN);
            case ')': return token(TokenType.RIGHT_PAREN);
            case '{': return token(TokenType.LEFT_BRACE);
            case '}': return token(TokenType.RIGHT_BRACE);
            case '[': return token(TokenType.LEFT_BRACKET);
            case ']': return token(TokenType.RIGHT_BRACKET);
            case ',': return token(TokenType.COMMA);
            case ':': return token(TokenType.COLON);
            case '.': return token(TokenType.DOT);
            case ';': return token(TokenType.SEMICOLON);
            case '+': return token(TokenType.PLUS);
            case '-': return token(match('>') ? TokenType.ARROW : TokenType.MINUS);
            case '—': return token(TokenType.DASH_ARROW);
            case '*': return token(TokenType.STAR);
            case '/': return token(TokenType.SLASH);
            case '%': return token(TokenType.PERCENT);
            case '!': return token(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '=': return token(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<': return token(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>': return token(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&':
                if (match('&')) return token(TokenType.AND_AND);
                throw error("Unexpected '&'");
            case '|':
                if (match('|')) return token(TokenType.OR_OR);
                throw error("Unexpected '|'");
            case '"':
            case '\'':
                return string(c);
            default:
                if (isDigit(c)) return number();
                if (isAlpha(c)) return identifier();
                throw error("Unexpected character: " + c);
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE) return token(type, Boolean.TRUE);
        if (type == TokenType.FALSE) return token(type, Boolean.FALSE);
        return token(type);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            return token(TokenType.FLOAT, Double.parseDouble(source.substring(start, current)));
        }
        String digits = source.substring(start, current);
        try {
            return token(TokenType.INTEGER, Long.parseLong(digits));
        } catch (NumberFormatException e) {
            throw error("Integer literal out of range: " + digits);
        }
    }

    private Token string(char quote) {
        int startLine = line;
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw new LexException("Unterminated string", startLine);
            }
            char c = advance();
            if (c == quote) break;
            if (c == '\n') line++;
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) {
                throw new LexException("Unterminated string", startLine);
            }
            char esc = advance();
            switch (esc) {
                case 'n': sb.append('\n'); break;
                case 't': sb.append('\t'); break;
                case 'r': sb.append('\r'); break;
                case '\\': sb.append('\\'); break;
                case '"': sb.append('"'); break;
                case '\'': sb.append('\''); break;
                default: throw error("Invalid escape sequence: \\" + esc);
            }
        }
        return new Token(TokenType.STRING, source.substring(start, current), sb.toString(), startLine);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private Token token(TokenType type) { return token(type, null); }
    private Token token(TokenType type, Object literal) {
        return new Token(type, source.substring(start, current), literal, line);
    }

    private LexException error(String msg) {
        return new LexException(msg, line);
    }
}
