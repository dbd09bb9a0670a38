package com.soorj.script.parser;

import java.util.List;

import com.soorj.script.SoorjScript.BuiltinFunction;

/** Adapts a host {@link BuiltinFunction} to a callable value. */
public final class NativeFunction implements Callee {
    private final String name;
    private final BuiltinFunction fn;

    public NativeFunction(String name, BuiltinFunction fn) {
        this.name = name;
        this.fn = fn;
    }

    @Override
    public String name() { return name; }

    @Override
    public Value call(Interpreter interpreter, List<Value> args, int line) {
        Value out = fn.call(args);
        return out == null ? Value.nil() : out;
    }

    @Override
    public String toString() {
        return "<builtin " + name + ">";
    }
}
