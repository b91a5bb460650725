package com.hiolang.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.hiolang.script.parser.Statement.FunctionStmt;
import com.hiolang.script.parser.Statement.Stmt;

/** A script-defined function, registered under its space-qualified name. */
public class UserFunction {
    final String name;
    final List<String> params;
    final List<Stmt> body;
    /** Space the function was declared in ("" at top level); calls from its body resolve relative to it. */
    final String space;
    final int line;

    UserFunction(String name, FunctionStmt decl, String space) {
        this.name = name;
        List<String> p = new ArrayList<>(decl.params.size());
        for (Token t : decl.params) p.add(t.lexeme);
        this.params = Collections.unmodifiableList(p);
        this.body = decl.body;
        this.space = space;
        this.line = decl.name.line;
    }

    public String name() { return name; }

    public int arity() { return params.size(); }

    Value call(Interpreter interpreter, List<Value> args, int callLine) {
        if (args.size() != params.size()) {
            throw new HioRuntimeException(ErrorKind.ARITY_MISMATCH,
                    name + "() expects " + params.size() + " arguments, got " + args.size(), callLine);
        }

        Environment env = interpreter.env;
        env.pushFrame();
        interpreter.enterSpace(space);
        try {
            for (int i = 0; i < params.size(); i++) {
                env.define(params.get(i), args.get(i));
            }
            Completion c = interpreter.executeSequence(body);
            return c.kind == Completion.Kind.RETURN ? c.value : Value.voidValue();
        } finally {
            interpreter.exitSpace();
            env.popFrame();
        }
    }
}
