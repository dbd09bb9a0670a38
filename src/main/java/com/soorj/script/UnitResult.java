package com.soorj.script;

import java.util.List;

import com.soorj.script.parser.Value;

/** Outcome of one evaluation unit run through {@link Session#execute(String)}. */
public class UnitResult {
    private final List<Value> expressionValues;
    private final boolean returned;

    public UnitResult(List<Value> expressionValues, boolean returned) {
        this.expressionValues = expressionValues;
        this.returned = returned;
    }

    /** Values of the unit's top-level expression statements, in source order. */
    public List<Value> expressionValues() { return expressionValues; }

    /** True when a top-level {@code տուր} cut the unit short. */
    public boolean returned() { return returned; }
}
