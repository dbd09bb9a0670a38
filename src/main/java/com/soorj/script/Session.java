package com.soorj.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.soorj.debug.Debug;
import com.soorj.script.parser.Completion;
import com.soorj.script.parser.Environment;
import com.soorj.script.parser.Interpreter;
import com.soorj.script.parser.ScriptError;
import com.soorj.script.parser.Statement.Stmt;
import com.soorj.script.parser.Value;

/**
 * Owns one root environment for its whole lifetime. Every unit passed to
 * {@link #execute(String)} sees the bindings left by the units before it.
 */
public class Session {

    private static final String TAG = "soorj.session";

    private final SoorjScript engine;
    private final Environment root;
    private final Interpreter interpreter;
    private int units = 0;

    Session(SoorjScript engine, Environment root) {
        this.engine = engine;
        this.root = root;
        this.interpreter = new Interpreter(root);
    }

    /**
     * Lexes, parses and evaluates one unit. Lexing and parsing finish before any
     * statement runs; the first {@link ScriptError} aborts the unit and propagates.
     */
    public UnitResult execute(String source) {
        return execute(source, null);
    }

    /**
     * Same as {@link #execute(String)}, but also passes each top-level expression value
     * to {@code onExpressionValue} as it is produced, so values computed before a
     * failing statement still reach the caller.
     */
    public UnitResult execute(String source, Consumer<Value> onExpressionValue) {
        int unit = ++units;
        Debug.get().d(TAG, "unit " + unit + ": " + source.length() + " chars");
        try {
            List<Stmt> program = engine.parse(source);
            List<Value> values = new ArrayList<>();
            Completion c = interpreter.execute(program, v -> {
                values.add(v);
                if (onExpressionValue != null) onExpressionValue.accept(v);
            });
            Debug.get().d(TAG, "unit " + unit + " finished" + (c.isReturned() ? " (top-level return)" : ""));
            return new UnitResult(Collections.unmodifiableList(values), c.isReturned());
        } catch (ScriptError e) {
            Debug.get().w(TAG, "unit " + unit + " failed: " + e.kind().label + " " + e.getMessage());
            throw e;
        }
    }

    public Value lookup(String name) {
        return root.get(name);
    }

    public boolean isDefined(String name) {
        return root.exists(name);
    }

    /** Snapshot of the root frame, builtins included. */
    public Map<String, Value> bindings() {
        return root.snapshot();
    }

    public Environment root() {
        return root;
    }

    public SoorjScript engine() {
        return engine;
    }
}
