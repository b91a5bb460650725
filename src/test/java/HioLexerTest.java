import com.hiolang.script.parser.LexException;
import com.hiolang.script.parser.Lexer;
import com.hiolang.script.parser.Token;
import com.hiolang.script.parser.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HioLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void letStatement_tokens() {
        List<Token> tokens = new Lexer("let x = 42;").tokenize();
        assertEquals(5 + 1, tokens.size());
        assertEquals(TokenType.LET, tokens.get(0).type);
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("x", tokens.get(1).lexeme);
        assertEquals(TokenType.EQUAL, tokens.get(2).type);
        assertEquals(TokenType.INTEGER, tokens.get(3).type);
        assertEquals(42L, tokens.get(3).literal);
        assertEquals(TokenType.SEMICOLON, tokens.get(4).type);
        assertEquals(TokenType.EOF, tokens.get(5).type);
    }

    @Test
    void keywords_areRecognized() {
        assertEquals(List.of(TokenType.SPACE, TokenType.END, TokenType.MAKE, TokenType.INSPACE, TokenType.CALL,
                TokenType.TEXT, TokenType.PUB, TokenType.SUBPUB, TokenType.FUNCTION, TokenType.RETURN,
                TokenType.IF, TokenType.ELSE, TokenType.WHILE, TokenType.FOR, TokenType.BREAK,
                TokenType.CONTINUE, TokenType.LET, TokenType.TRUE, TokenType.FALSE, TokenType.EOF),
                types("space end make inspace call text pub subpub function return if else while for break continue let true false"));
        assertTrue(Lexer.isKeyword("subpub"));
        assertFalse(Lexer.isKeyword("com"));
    }

    @Test
    void operators_twoCharFormsWin() {
        assertEquals(List.of(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                TokenType.AND_AND, TokenType.OR_OR, TokenType.ARROW, TokenType.LESS, TokenType.GREATER,
                TokenType.BANG, TokenType.EQUAL, TokenType.MINUS, TokenType.EOF),
                types("== != <= >= && || -> < > ! = -"));
    }

    @Test
    void emDash_isArrowAlternative() {
        assertEquals(List.of(TokenType.RIGHT_BRACE, TokenType.DASH_ARROW, TokenType.EOF), types("}\u2014"));
    }

    @Test
    void numbers_integerAndFloat() {
        List<Token> tokens = new Lexer("3.25 7").tokenize();
        assertEquals(TokenType.FLOAT, tokens.get(0).type);
        assertEquals(3.25, (Double) tokens.get(0).literal, 0.0);
        assertEquals(TokenType.INTEGER, tokens.get(1).type);
    }

    @Test
    void trailingDot_isNotPartOfNumber() {
        assertEquals(List.of(TokenType.INTEGER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.EOF), types("3.x"));
    }

    @Test
    void negativeLiteral_isMinusThenNumber() {
        assertEquals(List.of(TokenType.MINUS, TokenType.INTEGER, TokenType.EOF), types("-5"));
    }

    @Test
    void integerOutOfRange_fails() {
        LexException ex = assertThrows(LexException.class, () -> new Lexer("99999999999999999999").tokenize());
        assertTrue(ex.getMessage().contains("out of range"), ex.getMessage());
    }

    @Test
    void strings_bothQuotesAndEscapes() {
        List<Token> tokens = new Lexer("\"a\\tb\\n\" 'it\\'s'").tokenize();
        assertEquals(TokenType.STRING, tokens.get(0).type);
        assertEquals("a\tb\n", tokens.get(0).literal);
        assertEquals("it's", tokens.get(1).literal);
    }

    @Test
    void invalidEscape_fails() {
        assertThrows(LexException.class, () -> new Lexer("\"bad \\q\"").tokenize());
    }

    @Test
    void unterminatedString_reportsStartLine() {
        LexException ex = assertThrows(LexException.class, () -> new Lexer("let a = 1;\nlet s = \"open\n\n").tokenize());
        assertEquals(2, ex.line());
        assertTrue(ex.getMessage().contains("Unterminated string"));
    }

    @Test
    void doubleQuoteComment_runsToEndOfLine() {
        List<Token> tokens = new Lexer("'' a comment let x\nlet").tokenize();
        assertEquals(2, tokens.size());
        assertEquals(TokenType.LET, tokens.get(0).type);
        assertEquals(2, tokens.get(0).line);
    }

    @Test
    void loneAmpersandOrPipe_fails() {
        assertThrows(LexException.class, () -> new Lexer("a & b").tokenize());
        assertThrows(LexException.class, () -> new Lexer("a | b").tokenize());
    }

    @Test
    void unexpectedCharacter_fails() {
        LexException ex = assertThrows(LexException.class, () -> new Lexer("let x = 1;\n#").tokenize());
        assertEquals(2, ex.line());
    }

    @Test
    void lineNumbers_areTracked() {
        List<Token> tokens = new Lexer("a\nb\n\nc").tokenize();
        assertEquals(1, tokens.get(0).line);
        assertEquals(2, tokens.get(1).line);
        assertEquals(4, tokens.get(2).line);
    }

    @Test
    void nextToken_returnsEofRepeatedly() {
        Lexer lx = new Lexer("x");
        assertEquals(TokenType.IDENTIFIER, lx.nextToken().type);
        assertFalse(lx.isDone());
        assertEquals(TokenType.EOF, lx.nextToken().type);
        assertEquals(TokenType.EOF, lx.nextToken().type);
        assertTrue(lx.isDone());
    }

    @Test
    void tokenize_isDeterministic() {
        String src = "function f(a, b) { return a + b * 2; }";
        assertEquals(new Lexer(src).tokenize(), new Lexer(src).tokenize());
    }
}
