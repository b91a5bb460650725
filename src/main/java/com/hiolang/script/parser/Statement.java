package com.hiolang.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        <R> R accept(StmtVisitor<R> visitor);
    }

    public interface StmtVisitor<R> {
        R visitExprStmt(ExprStmt stmt);
        R visitLetStmt(LetStmt stmt);
        R visitAssignStmt(AssignStmt stmt);
        R visitBlockStmt(Block stmt);
        R visitIfStmt(If stmt);
        R visitWhileStmt(While stmt);
        R visitForStmt(For stmt);
        R visitBreakStmt(BreakStmt stmt);
        R visitContinueStmt(ContinueStmt stmt);
        R visitReturnStmt(ReturnStmt stmt);
        R visitFunctionStmt(FunctionStmt stmt);
        R visitSpaceStmt(SpaceStmt stmt);
        R visitPubStmt(PubStmt stmt);
        R visitSubpubStmt(SubpubStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitExprStmt(this); }
    }

    public static final class LetStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer;
        public LetStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitLetStmt(this); }
    }

    /** Assignment to a Variable, Index or Member target. */
    public static final class AssignStmt implements Stmt {
        public final Expr.ExprInterface target;
        public final Token equals;
        public final Expr.ExprInterface value;

        public AssignStmt(Expr.ExprInterface target, Token equals, Expr.ExprInterface value) {
            this.target = target;
            this.equals = equals;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitAssignStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements) { this.statements = statements; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block thenBranch;
        public final Block elseBranch; // may be null

        public If(Expr.ExprInterface condition, Block thenBranch, Block elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Block body;

        public While(Expr.ExprInterface condition, Block body) {
            this.condition = condition;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitWhileStmt(this); }
    }

    public static final class For implements Stmt {
        public final Stmt initializer;          // may be null
        public final Expr.ExprInterface condition; // may be null (loops forever)
        public final Stmt step;                 // may be null
        public final Block body;

        public For(Stmt initializer, Expr.ExprInterface condition, Stmt step, Block body) {
            this.initializer = initializer;
            this.condition = condition;
            this.step = step;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitForStmt(this); }
    }

    public static final class BreakStmt implements Stmt {
        public final Token keyword;
        public BreakStmt(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitBreakStmt(this); }
    }

    public static final class ContinueStmt implements Stmt {
        public final Token keyword;
        public ContinueStmt(Token keyword) { this.keyword = keyword; }
        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitContinueStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitReturnStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;

        public FunctionStmt(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = params;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitFunctionStmt(this); }
    }

    /** Namespace: functions declared inside are reachable as name.fn(...). */
    public static final class SpaceStmt implements Stmt {
        public final Token name;
        public final List<Stmt> body;

        public SpaceStmt(Token name, List<Stmt> body) {
            this.name = name;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSpaceStmt(this); }
    }

    /** Interpreted section marker. */
    public static final class PubStmt implements Stmt {
        public final Token keyword;
        public final String label;
        public final List<Stmt> body;

        public PubStmt(Token keyword, String label, List<Stmt> body) {
            this.keyword = keyword;
            this.label = label;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitPubStmt(this); }
    }

    /** Compiled section marker. */
    public static final class SubpubStmt implements Stmt {
        public final Token keyword;
        public final List<Stmt> body;

        public SubpubStmt(Token keyword, List<Stmt> body) {
            this.keyword = keyword;
            this.body = body;
        }

        public <R> R accept(StmtVisitor<R> visitor) { return visitor.visitSubpubStmt(this); }
    }
}
