package com.soorj.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.soorj.script.parser.ScriptError.NameError;

/**
 * One scope frame: a name-to-value map plus the enclosing frame used for lookup.
 * Only the root frame has no parent. Blocks, loop iterations, branches and calls
 * each run in a fresh child frame.
 */
public class Environment {

    public final Environment parent;
    private final Map<String, Value> values = new LinkedHashMap<>();

    public Environment() {
        this.parent = null;
    }

    private Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    /** Binds {@code name} in this frame, replacing any binding already here. */
    public void define(String name, Value value) {
        values.put(name, value);
    }

    public Value get(String name) {
        return get(name, 0);
    }

    Value get(String name, int line) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        throw new NameError(line, "Undefined variable: " + name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    /**
     * Updates the nearest existing binding of {@code name}; when no frame in the
     * chain has it, creates it in this frame.
     */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return;
            }
        }
        values.put(name, value);
    }

    /** Read-only view of this frame's own bindings, in definition order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }

    public int depth() {
        int d = 0;
        for (Environment e = parent; e != null; e = e.parent) d++;
        return d;
    }
}
