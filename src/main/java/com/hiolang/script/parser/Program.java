package com.hiolang.script.parser;

import java.util.Collections;
import java.util.List;

import com.hiolang.script.parser.Statement.PubStmt;
import com.hiolang.script.parser.Statement.Stmt;
import com.hiolang.script.parser.Statement.SubpubStmt;

/** Root of the AST: the ordered top-level statements of one parse. */
public final class Program {

    public enum ExecutionMode {
        INTERPRETED,
        COMPILED
    }

    private final List<Stmt> statements;

    public Program(List<Stmt> statements) {
        this.statements = Collections.unmodifiableList(statements);
    }

    public List<Stmt> statements() {
        return statements;
    }

    /**
     * The first top-level 'pub' or 'subpub' section picks the engine for the
     * whole program; a program with neither is interpreted.
     */
    public ExecutionMode executionMode() {
        for (Stmt s : statements) {
            if (s instanceof PubStmt) return ExecutionMode.INTERPRETED;
            if (s instanceof SubpubStmt) return ExecutionMode.COMPILED;
        }
        return ExecutionMode.INTERPRETED;
    }
}
