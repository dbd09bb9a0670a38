package com.soorj.script.parser;

/**
 * Outcome of running a statement or statement sequence: either it ran to the end,
 * or a {@code տուր} produced a value that must unwind to the nearest function call.
 */
public final class Completion {

    private static final Completion COMPLETED = new Completion(false, null);

    private final boolean returned;
    private final Value value;

    private Completion(boolean returned, Value value) {
        this.returned = returned;
        this.value = value;
    }

    public static Completion completed() { return COMPLETED; }

    public static Completion returned(Value value) {
        return new Completion(true, value == null ? Value.nil() : value);
    }

    public boolean isReturned() { return returned; }

    /** The returned value; only meaningful when {@link #isReturned()}. */
    public Value value() {
        if (!returned) throw new IllegalStateException("Completion carries no value");
        return value;
    }
}
