package com.hiolang.script.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hiolang.debug.Debug;
import com.hiolang.script.library.LibraryRegistry;
import com.hiolang.script.parser.Builtins;
import com.hiolang.script.parser.CallTargets;
import com.hiolang.script.parser.CompileException;
import com.hiolang.script.parser.ErrorKind;
import com.hiolang.script.parser.Expr;
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
import com.hiolang.script.parser.Program;
import com.hiolang.script.parser.Statement;
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
import com.hiolang.script.parser.Token;
import com.hiolang.script.parser.Value;

/**
 * Single-pass compiler from AST to {@link Chunk}s.
 *
 * Locals resolve to slots using the same scope boundaries the interpreter
 * pushes at runtime; anything else is a global. Forward jumps are emitted as
 * placeholders and backpatched from a pending-fixup list. Call names are
 * resolved after the whole program is seen, so calls may precede definitions.
 */
public class Compiler implements Expr.ExprVisitor<Void>, Statement.StmtVisitor<Void> {
    private static final String TAG = "hio.compiler";

    enum FixupKind { IF_FALSE, IF_END, LOOP_EXIT, BREAK, CONTINUE }

    private static final class Fixup {
        final int position;
        final FixupKind kind;

        Fixup(int position, FixupKind kind) {
            this.position = position;
            this.kind = kind;
        }
    }

    private static final class Loop {
        final List<Fixup> breaks = new ArrayList<>();
        final List<Fixup> continues = new ArrayList<>();
    }

    /** Compile-time state of the chunk being emitted. */
    private static final class FunctionState {
        final Chunk chunk;
        final List<Map<String, Integer>> scopes = new ArrayList<>();
        final Deque<Integer> scopeStarts = new ArrayDeque<>();
        final List<Fixup> pending = new ArrayList<>();
        final Deque<Loop> loops = new ArrayDeque<>();
        int nextSlot = 0;
        int maxSlots = 0;

        FunctionState(Chunk chunk) {
            this.chunk = chunk;
        }
    }

    private static final class PendingCall {
        final Chunk chunk;
        final int position;
        final String path;
        final String space;
        final int argc;
        final int line;

        PendingCall(Chunk chunk, int position, String path, String space, int argc, int line) {
            this.chunk = chunk;
            this.position = position;
            this.path = path;
            this.space = space;
            this.argc = argc;
            this.line = line;
        }
    }

    private final Builtins builtins;
    private final LibraryRegistry libraries;

    private final Map<String, Chunk> functions = new LinkedHashMap<>();
    private final List<PendingCall> calls = new ArrayList<>();
    private final Deque<String> spaces = new ArrayDeque<>();
    private FunctionState fs;

    public Compiler(Builtins builtins, LibraryRegistry libraries) {
        this.builtins = builtins;
        this.libraries = libraries;
    }

    public Chunk compile(Program program) {
        functions.clear();
        calls.clear();
        spaces.clear();

        Chunk main = new Chunk("<main>", 0);
        fs = new FunctionState(main);

        List<Stmt> stmts = program.statements();
        boolean resultOnStack = false;
        for (int i = 0; i < stmts.size(); i++) {
            Stmt s = stmts.get(i);
            if (i == stmts.size() - 1 && s instanceof ExprStmt) {
                ((ExprStmt) s).expression.accept(this);
                resultOnStack = true;
            } else {
                s.accept(this);
            }
        }
        if (!resultOnStack) emit(OpCode.PUSH_VOID, lastLine(main));
        emit(OpCode.RETURN, lastLine(main));
        finishChunk(fs);

        resolveCalls();
        for (Map.Entry<String, Chunk> e : functions.entrySet()) {
            main.addFunction(e.getKey(), e.getValue());
        }
        main.verify();

        if (Debug.get().enabled()) {
            Debug.get().d(TAG, "compiled " + main.size() + " ops, " + functions.size() + " functions");
        }
        return main;
    }

    // -------------------------
    // Emission helpers
    // -------------------------

    private int emit(BytecodeOp op) {
        return fs.chunk.emit(op);
    }

    private int emit(OpCode code, int line) {
        return emit(BytecodeOp.simple(code, line));
    }

    private Fixup emitJump(OpCode code, FixupKind kind, int line) {
        int pos = emit(BytecodeOp.withArg(code, BytecodeOp.UNPATCHED, line));
        Fixup f = new Fixup(pos, kind);
        fs.pending.add(f);
        return f;
    }

    private void patch(Fixup f, int target) {
        fs.chunk.patchTarget(f.position, target);
        fs.pending.remove(f);
    }

    private void patchHere(Fixup f) {
        patch(f, fs.chunk.size());
    }

    private static int lastLine(Chunk c) {
        return c.size() == 0 ? 0 : c.op(c.size() - 1).line;
    }

    private void finishChunk(FunctionState state) {
        if (!state.pending.isEmpty()) {
            Fixup f = state.pending.get(0);
            throw new CompileException(ErrorKind.UNRESOLVED_JUMP,
                    "Unpatched " + f.kind + " jump at " + state.chunk.name() + ":" + f.position,
                    state.chunk.op(f.position).line);
        }
        state.chunk.setSlotCount(state.maxSlots);
    }

    // -------------------------
    // Static scopes
    // -------------------------

    private void beginScope() {
        fs.scopes.add(new HashMap<>());
        fs.scopeStarts.push(fs.nextSlot);
    }

    private void endScope() {
        fs.scopes.remove(fs.scopes.size() - 1);
        fs.nextSlot = fs.scopeStarts.pop();
    }

    /** Slot for {@code name} in the innermost scope, reusing an existing one on redefinition. */
    private int declareLocal(String name) {
        Map<String, Integer> scope = fs.scopes.get(fs.scopes.size() - 1);
        Integer existing = scope.get(name);
        if (existing != null) return existing;
        int slot = fs.nextSlot++;
        fs.maxSlots = Math.max(fs.maxSlots, fs.nextSlot);
        scope.put(name, slot);
        return slot;
    }

    private Integer resolveLocal(String name) {
        for (int i = fs.scopes.size() - 1; i >= 0; i--) {
            Integer slot = fs.scopes.get(i).get(name);
            if (slot != null) return slot;
        }
        return null;
    }

    private String currentSpace() {
        return spaces.isEmpty() ? "" : spaces.peek();
    }

    // -------------------------
    // Statements
    // -------------------------

    private void compileSequence(List<Stmt> stmts) {
        for (Stmt s : stmts) s.accept(this);
    }

    public Void visitExprStmt(ExprStmt stmt) {
        stmt.expression.accept(this);
        emit(OpCode.POP, lineOf(stmt.expression));
        return null;
    }

    public Void visitLetStmt(LetStmt stmt) {
        stmt.initializer.accept(this);
        int line = stmt.name.line;
        if (fs.scopes.isEmpty()) {
            emit(BytecodeOp.named(OpCode.DEFINE_GLOBAL, stmt.name.lexeme, line));
        } else {
            emit(BytecodeOp.withArg(OpCode.SET_LOCAL, declareLocal(stmt.name.lexeme), line));
        }
        return null;
    }

    public Void visitAssignStmt(AssignStmt stmt) {
        int line = stmt.equals.line;
        if (stmt.target instanceof Variable) {
            String name = ((Variable) stmt.target).name.lexeme;
            stmt.value.accept(this);
            Integer slot = resolveLocal(name);
            if (slot != null) {
                emit(BytecodeOp.withArg(OpCode.SET_LOCAL, slot, line));
            } else {
                emit(BytecodeOp.named(OpCode.SET_GLOBAL, name, line));
            }
        } else if (stmt.target instanceof Index) {
            Index ix = (Index) stmt.target;
            ix.target.accept(this);
            ix.index.accept(this);
            stmt.value.accept(this);
            emit(OpCode.SET_INDEX, line);
        } else {
            Member m = (Member) stmt.target;
            m.target.accept(this);
            stmt.value.accept(this);
            emit(BytecodeOp.named(OpCode.SET_MEMBER, m.name.lexeme, line));
        }
        return null;
    }

    public Void visitBlockStmt(Block stmt) {
        beginScope();
        compileSequence(stmt.statements);
        endScope();
        return null;
    }

    public Void visitIfStmt(If stmt) {
        int line = lineOf(stmt.condition);
        stmt.condition.accept(this);
        Fixup skipThen = emitJump(OpCode.JUMP_IF_FALSE, FixupKind.IF_FALSE, line);
        stmt.thenBranch.accept(this);

        if (stmt.elseBranch == null) {
            patchHere(skipThen);
            return null;
        }

        Fixup skipElse = emitJump(OpCode.JUMP, FixupKind.IF_END, line);
        patchHere(skipThen);
        stmt.elseBranch.accept(this);
        patchHere(skipElse);
        return null;
    }

    public Void visitWhileStmt(While stmt) {
        int line = lineOf(stmt.condition);
        int start = fs.chunk.size();
        stmt.condition.accept(this);
        Fixup exit = emitJump(OpCode.JUMP_IF_FALSE, FixupKind.LOOP_EXIT, line);

        Loop loop = new Loop();
        fs.loops.push(loop);
        stmt.body.accept(this);
        fs.loops.pop();

        emit(BytecodeOp.withArg(OpCode.JUMP, start, line));
        patchHere(exit);
        for (Fixup f : loop.breaks) patchHere(f);
        for (Fixup f : loop.continues) patch(f, start);
        return null;
    }

    public Void visitForStmt(For stmt) {
        int line = stmt.condition != null ? lineOf(stmt.condition) : 0;
        beginScope();
        if (stmt.initializer != null) stmt.initializer.accept(this);

        int start = fs.chunk.size();
        Fixup exit = null;
        if (stmt.condition != null) {
            stmt.condition.accept(this);
            exit = emitJump(OpCode.JUMP_IF_FALSE, FixupKind.LOOP_EXIT, line);
        }

        Loop loop = new Loop();
        fs.loops.push(loop);
        stmt.body.accept(this);
        fs.loops.pop();

        int stepStart = fs.chunk.size();
        if (stmt.step != null) stmt.step.accept(this);
        emit(BytecodeOp.withArg(OpCode.JUMP, start, line));

        if (exit != null) patchHere(exit);
        for (Fixup f : loop.breaks) patchHere(f);
        for (Fixup f : loop.continues) patch(f, stepStart);
        endScope();
        return null;
    }

    public Void visitBreakStmt(BreakStmt stmt) {
        Loop loop = fs.loops.peek();
        if (loop == null) throw new IllegalStateException("break outside loop survived parsing");
        loop.breaks.add(emitJump(OpCode.JUMP, FixupKind.BREAK, stmt.keyword.line));
        return null;
    }

    public Void visitContinueStmt(ContinueStmt stmt) {
        Loop loop = fs.loops.peek();
        if (loop == null) throw new IllegalStateException("continue outside loop survived parsing");
        loop.continues.add(emitJump(OpCode.JUMP, FixupKind.CONTINUE, stmt.keyword.line));
        return null;
    }

    public Void visitReturnStmt(ReturnStmt stmt) {
        int line = stmt.keyword.line;
        if (stmt.value == null) {
            emit(OpCode.PUSH_VOID, line);
        } else {
            stmt.value.accept(this);
        }
        emit(OpCode.RETURN, line);
        return null;
    }

    public Void visitFunctionStmt(FunctionStmt stmt) {
        String space = currentSpace();
        String qualified = CallTargets.qualify(space, stmt.name.lexeme);
        Chunk chunk = new Chunk(qualified, stmt.params.size());
        functions.put(qualified, chunk);

        FunctionState enclosing = fs;
        fs = new FunctionState(chunk);
        try {
            beginScope();
            for (Token p : stmt.params) declareLocal(p.lexeme);
            compileSequence(stmt.body);
            emit(OpCode.PUSH_VOID, stmt.name.line);
            emit(OpCode.RETURN, stmt.name.line);
            endScope();
            finishChunk(fs);
        } finally {
            fs = enclosing;
        }
        Debug.get().t(TAG, "function " + qualified + ": " + chunk.size() + " ops, " + chunk.slotCount() + " slots");
        return null;
    }

    public Void visitSpaceStmt(SpaceStmt stmt) {
        spaces.push(CallTargets.qualify(currentSpace(), stmt.name.lexeme));
        beginScope();
        compileSequence(stmt.body);
        endScope();
        spaces.pop();
        return null;
    }

    public Void visitPubStmt(PubStmt stmt) {
        compileSequence(stmt.body);
        return null;
    }

    public Void visitSubpubStmt(SubpubStmt stmt) {
        compileSequence(stmt.body);
        return null;
    }

    // -------------------------
    // Expressions
    // -------------------------

    public Void visitLiteralExpr(Literal expr) {
        emit(BytecodeOp.constant(Value.fromLiteral(expr.value), expr.line));
        return null;
    }

    public Void visitArrayLiteralExpr(ArrayLiteral expr) {
        for (Expr.ExprInterface e : expr.elements) e.accept(this);
        emit(BytecodeOp.withArg(OpCode.ARRAY_CREATE, expr.elements.size(), expr.bracket.line));
        return null;
    }

    public Void visitObjectLiteralExpr(ObjectLiteral expr) {
        int line = expr.brace.line;
        for (Map.Entry<String, Expr.ExprInterface> e : expr.entries.entrySet()) {
            emit(BytecodeOp.constant(Value.text(e.getKey()), line));
            e.getValue().accept(this);
        }
        emit(BytecodeOp.withArg(OpCode.OBJECT_CREATE, expr.entries.size(), line));
        return null;
    }

    public Void visitVariableExpr(Variable expr) {
        Integer slot = resolveLocal(expr.name.lexeme);
        if (slot != null) {
            emit(BytecodeOp.withArg(OpCode.GET_LOCAL, slot, expr.name.line));
        } else {
            emit(BytecodeOp.named(OpCode.GET_GLOBAL, expr.name.lexeme, expr.name.line));
        }
        return null;
    }

    public Void visitBinaryExpr(Binary expr) {
        expr.left.accept(this);
        expr.right.accept(this);
        int line = expr.operator.line;
        switch (expr.operator.type) {
            case PLUS: emit(OpCode.ADD, line); break;
            case MINUS: emit(OpCode.SUB, line); break;
            case STAR: emit(OpCode.MUL, line); break;
            case SLASH: emit(OpCode.DIV, line); break;
            case PERCENT: emit(OpCode.MOD, line); break;
            case EQUAL_EQUAL: emit(OpCode.EQ, line); break;
            case BANG_EQUAL: emit(OpCode.NE, line); break;
            case LESS: emit(OpCode.LT, line); break;
            case LESS_EQUAL: emit(OpCode.LE, line); break;
            case GREATER: emit(OpCode.GT, line); break;
            case GREATER_EQUAL: emit(OpCode.GE, line); break;
            default:
                throw new IllegalStateException("Unsupported binary operator: " + expr.operator.type);
        }
        return null;
    }

    // a && b:  a JIF F; b JIF F; true JUMP E; F: false; E:
    // a || b:  a NOT JIF T; b NOT JIF T; false JUMP E; T: true; E:
    public Void visitLogicalExpr(Logical expr) {
        int line = expr.operator.line;
        boolean isOr = expr.operator.lexeme.equals("||");

        expr.left.accept(this);
        if (isOr) emit(OpCode.NOT, line);
        Fixup first = emitJump(OpCode.JUMP_IF_FALSE, FixupKind.IF_FALSE, line);
        expr.right.accept(this);
        if (isOr) emit(OpCode.NOT, line);
        Fixup second = emitJump(OpCode.JUMP_IF_FALSE, FixupKind.IF_FALSE, line);

        emit(BytecodeOp.constant(Value.bool(!isOr), line));
        Fixup end = emitJump(OpCode.JUMP, FixupKind.IF_END, line);
        patchHere(first);
        patchHere(second);
        emit(BytecodeOp.constant(Value.bool(isOr), line));
        patchHere(end);
        return null;
    }

    public Void visitUnaryExpr(Unary expr) {
        expr.right.accept(this);
        switch (expr.operator.type) {
            case BANG: emit(OpCode.NOT, expr.operator.line); break;
            case MINUS: emit(OpCode.NEG, expr.operator.line); break;
            default:
                throw new IllegalStateException("Unsupported unary operator: " + expr.operator.type);
        }
        return null;
    }

    public Void visitCallExpr(Call expr) {
        String path = expr.calleePath();
        if (path == null) {
            throw new CompileException(ErrorKind.INVALID_CALL_TARGET, "Invalid function call target", expr.paren.line);
        }
        for (Expr.ExprInterface a : expr.arguments) a.accept(this);
        int pos = emit(BytecodeOp.call(path, expr.arguments.size(), expr.paren.line));
        calls.add(new PendingCall(fs.chunk, pos, path, currentSpace(), expr.arguments.size(), expr.paren.line));
        return null;
    }

    public Void visitIndexExpr(Index expr) {
        expr.target.accept(this);
        expr.index.accept(this);
        emit(OpCode.INDEX, expr.bracket.line);
        return null;
    }

    public Void visitMemberExpr(Member expr) {
        expr.target.accept(this);
        emit(BytecodeOp.named(OpCode.MEMBER, expr.name.lexeme, expr.name.line));
        return null;
    }

    // -------------------------
    // Call resolution
    // -------------------------

    private void resolveCalls() {
        Iterator<PendingCall> it = calls.iterator();
        while (it.hasNext()) {
            PendingCall c = it.next();
            c.chunk.renameCall(c.position, resolve(c));
        }
        calls.clear();
    }

    private String resolve(PendingCall c) {
        for (String candidate : CallTargets.candidates(c.path, c.space)) {
            Chunk fn = functions.get(candidate);
            if (fn != null) {
                if (fn.arity() != c.argc) {
                    throw new CompileException(ErrorKind.ARITY_MISMATCH,
                            candidate + "() expects " + fn.arity() + " arguments, got " + c.argc, c.line);
                }
                return candidate;
            }
            if (builtins.has(candidate)) return candidate;
            // library functions stay as calls; the runner reports them as unbound
            if (libraries != null && candidate.indexOf('.') > 0 && libraries.lookupPath(candidate) != null) {
                return candidate;
            }
        }
        throw new CompileException(ErrorKind.UNDEFINED_FUNCTION, "Undefined function '" + c.path + "'", c.line);
    }

    private static int lineOf(Expr.ExprInterface e) {
        if (e instanceof Literal) return ((Literal) e).line;
        if (e instanceof Variable) return ((Variable) e).name.line;
        if (e instanceof Binary) return ((Binary) e).operator.line;
        if (e instanceof Logical) return ((Logical) e).operator.line;
        if (e instanceof Unary) return ((Unary) e).operator.line;
        if (e instanceof Call) return ((Call) e).paren.line;
        if (e instanceof Index) return ((Index) e).bracket.line;
        if (e instanceof Member) return ((Member) e).name.line;
        if (e instanceof ArrayLiteral) return ((ArrayLiteral) e).bracket.line;
        if (e instanceof ObjectLiteral) return ((ObjectLiteral) e).brace.line;
        return 0;
    }
}
