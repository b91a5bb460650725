package com.hiolang.script.parser;

import java.util.LinkedHashMap;
import java.util.List;

public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitArrayLiteralExpr(ArrayLiteral expr);
        R visitObjectLiteralExpr(ObjectLiteral expr);
        R visitVariableExpr(Variable expr);
        R visitBinaryExpr(Binary expr);
        R visitLogicalExpr(Logical expr);
        R visitUnaryExpr(Unary expr);
        R visitCallExpr(Call expr);
        R visitIndexExpr(Index expr);
        R visitMemberExpr(Member expr);
    }

    // -------------------------
    // Literals
    // -------------------------

    /** Integer (Long), Float (Double), Text (String) or Boolean literal. */
    public static final class Literal implements ExprInterface {
        public final Object value;
        public final int line;

        public Literal(Object value, int line) {
            this.value = value;
            this.line = line;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class ArrayLiteral implements ExprInterface {
        public final List<ExprInterface> elements;
        public final Token bracket;

        public ArrayLiteral(List<ExprInterface> elements, Token bracket) {
            this.elements = elements;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArrayLiteralExpr(this);
        }
    }

    public static final class ObjectLiteral implements ExprInterface {
        public final LinkedHashMap<String, ExprInterface> entries; // deterministic order
        public final Token brace;

        public ObjectLiteral(LinkedHashMap<String, ExprInterface> entries, Token brace) {
            this.entries = entries;
            this.brace = brace;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitObjectLiteralExpr(this);
        }
    }

    // -------------------------
    // References and operators
    // -------------------------

    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    /** Short-circuiting '&&' and '||'. */
    public static final class Logical implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Logical(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLogicalExpr(this);
        }
    }

    public static final class Unary implements ExprInterface {
        public final Token operator;
        public final ExprInterface right;

        public Unary(Token operator, ExprInterface right) {
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnaryExpr(this);
        }
    }

    // -------------------------
    // Postfix
    // -------------------------

    public static final class Call implements ExprInterface {
        public final ExprInterface callee;
        public final Token paren;
        public final List<ExprInterface> arguments;

        public Call(ExprInterface callee, Token paren, List<ExprInterface> arguments) {
            this.callee = callee;
            this.paren = paren;
            this.arguments = arguments;
        }

        /**
         * Dotted name of the callee ("print", "writeutil.text"), or null when the
         * callee is not a plain identifier path.
         */
        public String calleePath() {
            return pathOf(callee);
        }

        private static String pathOf(ExprInterface e) {
            if (e instanceof Variable) return ((Variable) e).name.lexeme;
            if (e instanceof Member) {
                Member m = (Member) e;
                String base = pathOf(m.target);
                return (base == null) ? null : base + "." + m.name.lexeme;
            }
            return null;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    public static final class Index implements ExprInterface {
        public final ExprInterface target;
        public final ExprInterface index;
        public final Token bracket;

        public Index(ExprInterface target, ExprInterface index, Token bracket) {
            this.target = target;
            this.index = index;
            this.bracket = bracket;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIndexExpr(this);
        }
    }

    public static final class Member implements ExprInterface {
        public final ExprInterface target;
        public final Token name;

        public Member(ExprInterface target, Token name) {
            this.target = target;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMemberExpr(this);
        }
    }
}
