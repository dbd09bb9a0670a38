package com.soorj.script.parser;

import java.util.List;

import com.soorj.debug.Debug;
import com.soorj.script.parser.ScriptError.ArityError;
import com.soorj.script.parser.Statement.Block;

public class UserFunction implements Callee {
    final String name;
    final List<Token> params;
    final Block body;
    final Environment closure;

    UserFunction(String name, List<Token> params, Block body, Environment closure) {
        this.name = name;
        this.params = params;
        this.body = body;
        this.closure = closure;
    }

    @Override
    public String name() { return name; }

    public int arity() { return params.size(); }

    @Override
    public Value call(Interpreter interpreter, List<Value> args, int line) {
        if (args.size() != params.size()) {
            throw new ArityError(line, name + "() expects " + params.size() + " arguments, got " + args.size());
        }
        Debug.get().t("soorj.call", name + "/" + args.size() + " at line " + line);

        // The call frame hangs off the closure, not the caller: scoping is lexical.
        Environment frame = closure.childScope();
        for (int i = 0; i < params.size(); i++) {
            frame.define(params.get(i).lexeme, args.get(i));
        }

        Completion c = interpreter.executeSequence(body.statements, frame);
        return c.isReturned() ? c.value() : Value.nil();
    }

    @Override
    public String toString() {
        return "<գործ " + name + ">";
    }
}
