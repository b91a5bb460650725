package com.hiolang.script.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hiolang.debug.Debug;
import com.hiolang.script.HioScript.BuiltinFunction;
import com.hiolang.script.library.LibraryFunction;
import com.hiolang.script.library.LibraryRegistry;
import com.hiolang.script.parser.Expr.ArrayLiteral;
import com.hiolang.script.parser.Expr.Binary;
import com.hiolang.script.parser.Expr.Call;
import com.hiolang.script.parser.Expr.ExprVisitor;
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
import com.hiolang.script.parser.Statement.StmtVisitor;
import com.hiolang.script.parser.Statement.SubpubStmt;
import com.hiolang.script.parser.Statement.While;

/**
 * Tree-walking evaluator. Statements return a {@link Completion}; expressions
 * return a {@link Value}. One instance keeps its globals and functions across
 * {@link #execute} calls, which is what the REPL relies on.
 */
public class Interpreter implements ExprVisitor<Value>, StmtVisitor<Completion> {
    private static final String TAG = "hio.interp";

    final Environment env;
    private final Builtins builtins;
    private final LibraryRegistry libraries;
    private final Map<String, UserFunction> userFunctions = new LinkedHashMap<>();
    private final Deque<CallFrame> callStack = new ArrayDeque<CallFrame>();
    private final Deque<String> spaces = new ArrayDeque<>();
    private final int maxDepth;

    public Interpreter(Environment env, Builtins builtins, LibraryRegistry libraries, int maxDepth) {
        this.env = env;
        this.builtins = builtins;
        this.libraries = libraries;
        this.maxDepth = maxDepth;
    }

    /**
     * Runs a whole program. Returns the value of a top-level return, else the
     * value of the last statement when it is an expression statement, else Void.
     */
    public Value execute(Program program) {
        declareFunctions(program.statements(), "");

        Value result = Value.voidValue();
        for (Stmt stmt : program.statements()) {
            if (stmt instanceof ExprStmt) {
                result = eval(((ExprStmt) stmt).expression);
                continue;
            }
            result = Value.voidValue();
            Completion c = stmt.accept(this);
            if (c.kind == Completion.Kind.RETURN) return c.value;
        }
        return result;
    }

    public Map<String, Value> globals() {
        return env.globals();
    }

    public String currentFunctionName() {
        return callStack.isEmpty() ? null : callStack.peek().functionName;
    }

    /** Calls a script function or builtin by (qualified) name from host code. */
    public Value invokeForHost(String name, List<Value> args) {
        return invoke(name, args, 0);
    }

    // Functions are visible program-wide before any statement runs, so calls
    // may precede definitions. Later definitions of the same name win.
    private void declareFunctions(List<Stmt> stmts, String space) {
        for (Stmt s : stmts) {
            if (s instanceof FunctionStmt) {
                FunctionStmt f = (FunctionStmt) s;
                String qualified = CallTargets.qualify(space, f.name.lexeme);
                userFunctions.put(qualified, new UserFunction(qualified, f, space));
                declareFunctions(f.body, space);
            } else if (s instanceof SpaceStmt) {
                SpaceStmt sp = (SpaceStmt) s;
                declareFunctions(sp.body, CallTargets.qualify(space, sp.name.lexeme));
            } else if (s instanceof Block) {
                declareFunctions(((Block) s).statements, space);
            } else if (s instanceof If) {
                If i = (If) s;
                declareFunctions(i.thenBranch.statements, space);
                if (i.elseBranch != null) declareFunctions(i.elseBranch.statements, space);
            } else if (s instanceof While) {
                declareFunctions(((While) s).body.statements, space);
            } else if (s instanceof For) {
                declareFunctions(((For) s).body.statements, space);
            } else if (s instanceof PubStmt) {
                declareFunctions(((PubStmt) s).body, space);
            } else if (s instanceof SubpubStmt) {
                declareFunctions(((SubpubStmt) s).body, space);
            }
        }
    }

    Completion executeSequence(List<Stmt> stmts) {
        for (Stmt s : stmts) {
            Completion c = s.accept(this);
            if (!c.isNormal()) return c;
        }
        return Completion.NORMAL;
    }

    String currentSpace() {
        return spaces.isEmpty() ? "" : spaces.peek();
    }

    void enterSpace(String space) {
        spaces.push(space);
    }

    void exitSpace() {
        spaces.pop();
    }

    private Value eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    // -------------------------
    // Statements
    // -------------------------

    public Completion visitExprStmt(ExprStmt stmt) {
        eval(stmt.expression);
        return Completion.NORMAL;
    }

    public Completion visitLetStmt(LetStmt stmt) {
        env.define(stmt.name.lexeme, eval(stmt.initializer));
        return Completion.NORMAL;
    }

    public Completion visitAssignStmt(AssignStmt stmt) {
        int line = stmt.equals.line;
        if (stmt.target instanceof Variable) {
            Value value = eval(stmt.value);
            env.assign(((Variable) stmt.target).name.lexeme, value, line);
        } else if (stmt.target instanceof Index) {
            Index ix = (Index) stmt.target;
            Value target = eval(ix.target);
            Value index = eval(ix.index);
            Value value = eval(stmt.value);
            Operators.setIndex(target, index, value, line);
        } else {
            Member m = (Member) stmt.target;
            Value target = eval(m.target);
            Value value = eval(stmt.value);
            Operators.setMember(target, m.name.lexeme, value, line);
        }
        return Completion.NORMAL;
    }

    public Completion visitBlockStmt(Block stmt) {
        env.pushScope();
        try {
            return executeSequence(stmt.statements);
        } finally {
            env.popScope();
        }
    }

    public Completion visitIfStmt(If stmt) {
        if (eval(stmt.condition).isTruthy()) return stmt.thenBranch.accept(this);
        if (stmt.elseBranch != null) return stmt.elseBranch.accept(this);
        return Completion.NORMAL;
    }

    public Completion visitWhileStmt(While stmt) {
        while (eval(stmt.condition).isTruthy()) {
            Completion c = stmt.body.accept(this);
            if (c.kind == Completion.Kind.BREAK) break;
            if (c.kind == Completion.Kind.RETURN) return c;
        }
        return Completion.NORMAL;
    }

    public Completion visitForStmt(For stmt) {
        env.pushScope();
        try {
            if (stmt.initializer != null) stmt.initializer.accept(this);
            while (stmt.condition == null || eval(stmt.condition).isTruthy()) {
                Completion c = stmt.body.accept(this);
                if (c.kind == Completion.Kind.BREAK) break;
                if (c.kind == Completion.Kind.RETURN) return c;
                if (stmt.step != null) stmt.step.accept(this);
            }
            return Completion.NORMAL;
        } finally {
            env.popScope();
        }
    }

    public Completion visitBreakStmt(BreakStmt stmt) {
        return Completion.BREAK;
    }

    public Completion visitContinueStmt(ContinueStmt stmt) {
        return Completion.CONTINUE;
    }

    public Completion visitReturnStmt(ReturnStmt stmt) {
        Value value = (stmt.value == null) ? Value.voidValue() : eval(stmt.value);
        return Completion.returning(value);
    }

    public Completion visitFunctionStmt(FunctionStmt stmt) {
        // registered up front by declareFunctions
        return Completion.NORMAL;
    }

    public Completion visitSpaceStmt(SpaceStmt stmt) {
        String space = CallTargets.qualify(currentSpace(), stmt.name.lexeme);
        Debug.get().t(TAG, "enter space " + space);
        env.pushScope();
        enterSpace(space);
        try {
            return executeSequence(stmt.body);
        } finally {
            exitSpace();
            env.popScope();
        }
    }

    public Completion visitPubStmt(PubStmt stmt) {
        Debug.get().d(TAG, "pub section '" + stmt.label + "'");
        return executeSequence(stmt.body);
    }

    public Completion visitSubpubStmt(SubpubStmt stmt) {
        Debug.get().d(TAG, "subpub section");
        return executeSequence(stmt.body);
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Value visitLiteralExpr(Literal expr) {
        return Value.fromLiteral(expr.value);
    }

    public Value visitArrayLiteralExpr(ArrayLiteral expr) {
        List<Value> items = new ArrayList<Value>(expr.elements.size());
        for (Expr.ExprInterface e : expr.elements) items.add(eval(e));
        return Value.array(items);
    }

    public Value visitObjectLiteralExpr(ObjectLiteral expr) {
        Map<String, Value> entries = new LinkedHashMap<>();
        for (Map.Entry<String, Expr.ExprInterface> e : expr.entries.entrySet()) {
            entries.put(e.getKey(), eval(e.getValue()));
        }
        return Value.object(entries);
    }

    public Value visitVariableExpr(Variable expr) {
        return env.get(expr.name.lexeme, expr.name.line);
    }

    public Value visitBinaryExpr(Binary expr) {
        Value left = eval(expr.left);
        Value right = eval(expr.right);
        int line = expr.operator.line;

        switch (expr.operator.type) {
            case PLUS: return Operators.add(left, right, line);
            case MINUS: return Operators.subtract(left, right, line);
            case STAR: return Operators.multiply(left, right, line);
            case SLASH: return Operators.divide(left, right, line);
            case PERCENT: return Operators.modulo(left, right, line);
            case LESS:
            case LESS_EQUAL:
            case GREATER:
            case GREATER_EQUAL:
                return Operators.compare(expr.operator.lexeme, left, right, line);
            case EQUAL_EQUAL: return Value.bool(Operators.equal(left, right));
            case BANG_EQUAL: return Value.bool(!Operators.equal(left, right));
            default:
                throw new IllegalStateException("Unsupported binary operator: " + expr.operator.type);
        }
    }

    public Value visitLogicalExpr(Logical expr) {
        boolean left = eval(expr.left).isTruthy();
        if (expr.operator.type == TokenType.OR_OR) {
            if (left) return Value.bool(true);
        } else {
            if (!left) return Value.bool(false);
        }
        return Value.bool(eval(expr.right).isTruthy());
    }

    public Value visitUnaryExpr(Unary expr) {
        Value right = eval(expr.right);
        switch (expr.operator.type) {
            case BANG: return Operators.not(right);
            case MINUS: return Operators.negate(right, expr.operator.line);
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
    }

    public Value visitIndexExpr(Index expr) {
        Value target = eval(expr.target);
        Value index = eval(expr.index);
        return Operators.index(target, index, expr.bracket.line);
    }

    public Value visitMemberExpr(Member expr) {
        return Operators.member(eval(expr.target), expr.name.lexeme, expr.name.line);
    }

    public Value visitCallExpr(Call expr) {
        String path = expr.calleePath();
        if (path == null) {
            throw new HioRuntimeException(ErrorKind.INVALID_CALL_TARGET, "Invalid function call target", expr.paren.line);
        }

        List<Value> args = new ArrayList<Value>(expr.arguments.size());
        for (Expr.ExprInterface a : expr.arguments) args.add(eval(a));

        return invoke(path, args, expr.paren.line);
    }

    private Value invoke(String path, List<Value> args, int line) {
        for (String candidate : CallTargets.candidates(path, currentSpace())) {
            UserFunction uf = userFunctions.get(candidate);
            if (uf != null) return callUser(uf, args, line);

            BuiltinFunction fn = builtins.get(candidate);
            if (fn != null) return Builtins.call(candidate, fn, args, line);

            if (libraries != null && candidate.indexOf('.') > 0) {
                LibraryFunction lf = libraries.lookupPath(candidate);
                if (lf != null) throw unboundLibraryCall(candidate, lf, args.size(), line);
            }
        }
        throw new HioRuntimeException(ErrorKind.UNDEFINED_FUNCTION, "Undefined function '" + path + "'", line);
    }

    private Value callUser(UserFunction uf, List<Value> args, int line) {
        if (callStack.size() >= maxDepth) {
            throw new HioRuntimeException(ErrorKind.CALL_DEPTH_EXCEEDED,
                    "Maximum call depth of " + maxDepth + " exceeded calling " + uf.name, line);
        }
        if (Debug.get().enabled()) {
            String caller = currentFunctionName();
            Debug.get().t(TAG, "call " + uf.name + " from " + (caller == null ? "<main>" : caller)
                    + " depth=" + (callStack.size() + 1));
        }
        callStack.push(new CallFrame(uf.name, Collections.unmodifiableList(args), line));
        try {
            return uf.call(this, args, line);
        } finally {
            callStack.pop();
        }
    }

    /** Arity-checks a library call; a matching call still fails, as library code is never run. */
    public static HioRuntimeException unboundLibraryCall(String path, LibraryFunction fn, int argc, int line) {
        if (argc != fn.arity()) {
            return new HioRuntimeException(ErrorKind.ARITY_MISMATCH,
                    path + "() expects " + fn.arity() + " arguments, got " + argc, line);
        }
        return new HioRuntimeException(ErrorKind.UNBOUND_LIBRARY_FUNCTION,
                "Library function " + path + " is implemented in " + fn.implementationLanguage()
                        + " and cannot be called from a script", line);
    }
}
