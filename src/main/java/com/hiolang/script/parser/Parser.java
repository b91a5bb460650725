package com.hiolang.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.hiolang.script.parser.Expr.ArrayLiteral;
import com.hiolang.script.parser.Expr.Binary;
import com.hiolang.script.parser.Expr.Call;
import com.hiolang.script.parser.Expr.Index;
import com.hiolang.script.parser.Expr.Literal;
import com.hiolang.script.parser.Expr.Logical;
import com.hiolang.script.parser.Expr.Member;
import com.hiolang.script.parser.Expr.ObjectLiteral;
import com.hiolang.script.parser.Expr.Unary;
import com.hiolang.script.parser.Expr.Variable;
import com.hiolang.script.parser.Statement.AssignStmt;
import com.hiolang.script.parser.Statement.Block;
import com.hiolang.script.parser.Statement.ExprStmt;
import com.hiolang.script.parser.Statement.FunctionStmt;
import com.hiolang.script.parser.Statement.Stmt;

/**
 * Recursive-descent parser, one method per grammar level. The first error
 * aborts the parse with a {@link ParseException}; there is no recovery.
 */
public class Parser {
    private static final int MAX_PARAMS = 64;

    private final List<Token> tokens;
    private int current = 0;
    private int loopDepth = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    /** Lexes and parses in one go. */
    public static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parse();
    }

    public Program parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(statement());
        }
        return new Program(statements);
    }

    private Stmt statement() {
        if (match(TokenType.LET)) return letStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.BREAK)) return breakStatement();
        if (match(TokenType.CONTINUE)) return continueStatement();
        if (match(TokenType.FUNCTION)) return functionDeclaration();
        if (match(TokenType.SPACE)) return spaceStatement();
        if (match(TokenType.PUB)) return pubStatement();
        if (match(TokenType.SUBPUB)) return subpubStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(blockBody());
        Stmt s = simpleStatement();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return s;
    }

    private Stmt letStatement() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name after 'let'.");
        consume(TokenType.EQUAL, "Expect '=' after variable name.");
        Expr.ExprInterface initializer = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new Statement.LetStmt(name, initializer);
    }

    // expression statement or assignment, without the trailing ';'
    private Stmt simpleStatement() {
        Expr.ExprInterface expr = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = expression();
            if (expr instanceof Variable || expr instanceof Index || expr instanceof Member) {
                return new AssignStmt(expr, equals, value);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return new ExprStmt(expr);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        Block thenBranch = block("if condition");
        Block elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                List<Stmt> chained = new ArrayList<>();
                chained.add(ifStatement());
                elseBranch = new Block(chained);
            } else {
                elseBranch = block("'else'");
            }
        }
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");

        loopDepth++;
        try {
            return new Statement.While(condition, block("while condition"));
        } finally {
            loopDepth--;
        }
    }

    // for (init; cond; step) { body }
    private Stmt forStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (match(TokenType.LET)) {
            initializer = letStatement(); // consumes first ';'
        } else {
            initializer = simpleStatement();
            consume(TokenType.SEMICOLON, "Expect ';' after loop initializer.");
        }

        Expr.ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        Stmt step = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            step = simpleStatement();
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");

        loopDepth++;
        try {
            return new Statement.For(initializer, condition, step, block("for clauses"));
        } finally {
            loopDepth--;
        }
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt breakStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'break' used outside of a loop.");
        }
        consume(TokenType.SEMICOLON, "Expect ';' after 'break'.");
        return new Statement.BreakStmt(keyword);
    }

    private Stmt continueStatement() {
        Token keyword = previous();
        if (loopDepth <= 0) {
            throw error(keyword, "'continue' used outside of a loop.");
        }
        consume(TokenType.SEMICOLON, "Expect ';' after 'continue'.");
        return new Statement.ContinueStmt(keyword);
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");

        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");

        // break/continue inside a function body never target an enclosing loop
        int savedLoopDepth = loopDepth;
        loopDepth = 0;
        try {
            consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
            return new FunctionStmt(name, params, blockBody());
        } finally {
            loopDepth = savedLoopDepth;
        }
    }

    // space Name [name] { ... } end make;
    private Stmt spaceStatement() {
        Token name = consume(TokenType.IDENTIFIER, "Expect namespace name after 'space'.");
        match(TokenType.IDENTIFIER); // optional 'name' word
        consume(TokenType.LEFT_BRACE, "Expect '{' after namespace name.");
        List<Stmt> body = blockBody();
        consume(TokenType.END, "Expect 'end' after namespace body.");
        consume(TokenType.MAKE, "Expect 'make' after 'end'.");
        consume(TokenType.SEMICOLON, "Expect ';' after 'end make'.");
        return new Statement.SpaceStmt(name, body);
    }

    // pub; { com "label" { ... } } ->
    private Stmt pubStatement() {
        Token keyword = previous();
        consume(TokenType.SEMICOLON, "Expect ';' after 'pub'.");
        consume(TokenType.LEFT_BRACE, "Expect '{' after 'pub;'.");
        match(TokenType.SEMICOLON);
        Token com = consume(TokenType.IDENTIFIER, "Expect 'com' in pub section.");
        if (!"com".equals(com.lexeme)) {
            throw error(com, "Expect 'com' in pub section.");
        }
        Token label = consume(TokenType.STRING, "Expect section label string after 'com'.");
        consume(TokenType.LEFT_BRACE, "Expect '{' after section label.");
        List<Stmt> body = blockBody();
        consume(TokenType.RIGHT_BRACE, "Expect '}' to close pub section.");
        if (!match(TokenType.ARROW, TokenType.DASH_ARROW)) {
            throw error(peek(), "Expect '->' after pub section.");
        }
        match(TokenType.SEMICOLON);
        return new Statement.PubStmt(keyword, (String) label.literal, body);
    }

    // subpub; { ... }
    private Stmt subpubStatement() {
        Token keyword = previous();
        consume(TokenType.SEMICOLON, "Expect ';' after 'subpub'.");
        consume(TokenType.LEFT_BRACE, "Expect '{' after 'subpub;'.");
        return new Statement.SubpubStmt(keyword, blockBody());
    }

    private Block block(String after) {
        consume(TokenType.LEFT_BRACE, "Expect '{' after " + after + ".");
        return new Block(blockBody());
    }

    // statements up to and including the closing '}'
    private List<Stmt> blockBody() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    // -------------------------
    // Expressions
    // -------------------------

    private Expr.ExprInterface expression() { return or(); }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR_OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND_AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            if (op.type == TokenType.MINUS && right instanceof Literal) {
                Object v = ((Literal) right).value;
                if (v instanceof Long) return new Literal(-(Long) v, op.line);
                if (v instanceof Double) return new Literal(-(Double) v, op.line);
            }
            return new Unary(op, right);
        }
        return postfix();
    }

    private Expr.ExprInterface postfix() {
        Expr.ExprInterface expr = primary();

        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                expr = finishCall(expr);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                Expr.ExprInterface index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expect ']' after index.");
                expr = new Index(expr, index, bracket);
            } else if (match(TokenType.DOT)) {
                expr = new Member(expr, memberName());
            } else {
                break;
            }
        }

        return expr;
    }

    // keywords are allowed as member names: writeutil.text(...)
    private Token memberName() {
        if (check(TokenType.IDENTIFIER) || peek().isKeyword()) return advance();
        throw error(peek(), "Expect member name after '.'.");
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();

        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }

        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE, TokenType.TRUE, TokenType.INTEGER, TokenType.FLOAT, TokenType.STRING)) {
            return new Literal(previous().literal, previous().line);
        }
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<Expr.ExprInterface> items = new ArrayList<Expr.ExprInterface>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    items.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "Expect ']' after array literal.");
            return new ArrayLiteral(items, bracket);
        }

        // Object literal (JSON-style)
        if (match(TokenType.LEFT_BRACE)) {
            Token brace = previous();
            LinkedHashMap<String, Expr.ExprInterface> entries = new LinkedHashMap<>();
            if (!check(TokenType.RIGHT_BRACE)) {
                do {
                    String key;
                    if (match(TokenType.STRING)) {
                        key = (String) previous().literal;
                    } else if (match(TokenType.IDENTIFIER)) {
                        key = previous().lexeme;
                    } else {
                        throw error(peek(), "Expect object key (string or identifier).");
                    }
                    consume(TokenType.COLON, "Expect ':' after object key.");
                    entries.put(key, expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACE, "Expect '}' after object literal.");
            return new ObjectLiteral(entries, brace);
        }

        // call.name(args) is sugar for name(args)
        if (match(TokenType.CALL)) {
            consume(TokenType.DOT, "Expect '.' after 'call'.");
            Token name = consume(TokenType.IDENTIFIER, "Expect function name after 'call.'.");
            consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
            return finishCall(new Variable(name));
        }

        throw error(peek(), "Expect expression.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseException error(Token token, String message) {
        return new ParseException(token, message);
    }
}
