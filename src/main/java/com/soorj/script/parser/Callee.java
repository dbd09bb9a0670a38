package com.soorj.script.parser;

import java.util.List;

/** Payload of a function value: a user-defined closure or a host builtin. */
public interface Callee {

    String name();

    /**
     * @param line source line of the call site, for error reporting
     */
    Value call(Interpreter interpreter, List<Value> args, int line);
}
