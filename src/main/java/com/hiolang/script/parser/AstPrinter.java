package com.hiolang.script.parser;

import java.util.List;
import java.util.Map;

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
import com.hiolang.script.parser.Statement.BreakStmt;
import com.hiolang.script.parser.Statement.ContinueStmt;
import com.hiolang.script.parser.Statement.ExprStmt;
import com.hiolang.script.parser.Statement.For;
import com.hiolang.script.parser.Statement.FunctionStmt;
import com.hiolang.script.parser.Statement.If;
import com.hiolang.script.parser.Statement.LetStmt;
import com.hiolang.script.parser.Statement.PubStmt;
import com.hiolang.script.parser.Statement.ReturnStmt;
import com.hiolang.script.parser.Statement.SpaceStmt;
import com.hiolang.script.parser.Statement.Stmt;
import com.hiolang.script.parser.Statement.SubpubStmt;
import com.hiolang.script.parser.Statement.While;

/** Renders an AST as one S-expression per top-level statement. */
public class AstPrinter implements Expr.ExprVisitor<String>, Statement.StmtVisitor<String> {

    public String print(Program program) {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : program.statements()) {
            sb.append(s.accept(this)).append('\n');
        }
        return sb.toString();
    }

    public String print(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    private String seq(List<Stmt> stmts) {
        StringBuilder sb = new StringBuilder();
        for (Stmt s : stmts) sb.append(' ').append(s.accept(this));
        return sb.toString();
    }

    private String group(String head, Expr.ExprInterface... parts) {
        StringBuilder sb = new StringBuilder("(").append(head);
        for (Expr.ExprInterface p : parts) sb.append(' ').append(p.accept(this));
        return sb.append(')').toString();
    }

    // statements

    public String visitExprStmt(ExprStmt stmt) { return group("expr", stmt.expression); }
    public String visitLetStmt(LetStmt stmt) { return group("let " + stmt.name.lexeme, stmt.initializer); }
    public String visitAssignStmt(AssignStmt stmt) { return group("=", stmt.target, stmt.value); }
    public String visitBlockStmt(Block stmt) { return "(block" + seq(stmt.statements) + ")"; }

    public String visitIfStmt(If stmt) {
        String s = "(if " + stmt.condition.accept(this) + " " + stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) s += " " + stmt.elseBranch.accept(this);
        return s + ")";
    }

    public String visitWhileStmt(While stmt) {
        return "(while " + stmt.condition.accept(this) + " " + stmt.body.accept(this) + ")";
    }

    public String visitForStmt(For stmt) {
        return "(for "
                + (stmt.initializer == null ? "_" : stmt.initializer.accept(this)) + " "
                + (stmt.condition == null ? "_" : stmt.condition.accept(this)) + " "
                + (stmt.step == null ? "_" : stmt.step.accept(this)) + " "
                + stmt.body.accept(this) + ")";
    }

    public String visitBreakStmt(BreakStmt stmt) { return "(break)"; }
    public String visitContinueStmt(ContinueStmt stmt) { return "(continue)"; }

    public String visitReturnStmt(ReturnStmt stmt) {
        return stmt.value == null ? "(return)" : group("return", stmt.value);
    }

    public String visitFunctionStmt(FunctionStmt stmt) {
        StringBuilder sb = new StringBuilder("(function ").append(stmt.name.lexeme).append(" (");
        for (int i = 0; i < stmt.params.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(stmt.params.get(i).lexeme);
        }
        return sb.append(')').append(seq(stmt.body)).append(')').toString();
    }

    public String visitSpaceStmt(SpaceStmt stmt) { return "(space " + stmt.name.lexeme + seq(stmt.body) + ")"; }
    public String visitPubStmt(PubStmt stmt) { return "(pub \"" + stmt.label + "\"" + seq(stmt.body) + ")"; }
    public String visitSubpubStmt(SubpubStmt stmt) { return "(subpub" + seq(stmt.body) + ")"; }

    // expressions

    public String visitLiteralExpr(Literal expr) {
        if (expr.value instanceof String) return "\"" + expr.value + "\"";
        return String.valueOf(expr.value);
    }

    public String visitArrayLiteralExpr(ArrayLiteral expr) {
        return group("array", expr.elements.toArray(new Expr.ExprInterface[0]));
    }

    public String visitObjectLiteralExpr(ObjectLiteral expr) {
        StringBuilder sb = new StringBuilder("(object");
        for (Map.Entry<String, Expr.ExprInterface> e : expr.entries.entrySet()) {
            sb.append(" (").append(e.getKey()).append(' ').append(e.getValue().accept(this)).append(')');
        }
        return sb.append(')').toString();
    }

    public String visitVariableExpr(Variable expr) { return expr.name.lexeme; }
    public String visitBinaryExpr(Binary expr) { return group(expr.operator.lexeme, expr.left, expr.right); }
    public String visitLogicalExpr(Logical expr) { return group(expr.operator.lexeme, expr.left, expr.right); }
    public String visitUnaryExpr(Unary expr) { return group(expr.operator.lexeme, expr.right); }

    public String visitCallExpr(Call expr) {
        StringBuilder sb = new StringBuilder("(call ").append(expr.callee.accept(this));
        for (Expr.ExprInterface a : expr.arguments) sb.append(' ').append(a.accept(this));
        return sb.append(')').toString();
    }

    public String visitIndexExpr(Index expr) { return group("index", expr.target, expr.index); }

    public String visitMemberExpr(Member expr) {
        return "(. " + expr.target.accept(this) + " " + expr.name.lexeme + ")";
    }
}
