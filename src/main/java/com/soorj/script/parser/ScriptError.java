package com.soorj.script.parser;

/**
 * Base of every language-level failure. The first one raised aborts the current
 * evaluation unit; hosts decide whether to continue (REPL) or stop (file mode).
 */
public abstract class ScriptError extends RuntimeException {

    public enum Kind {
        LEX("LexError"),
        PARSE("ParseError"),
        NAME("NameError"),
        TYPE("TypeError"),
        ARITY("ArityError"),
        ARITHMETIC("ArithmeticError"),
        VALUE("ValueError");

        public final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    private final Kind kind;
    private final int line;

    protected ScriptError(Kind kind, int line, String message) {
        super(line > 0 ? "[line " + line + "] " + message : message);
        this.kind = kind;
        this.line = line;
    }

    public Kind kind() { return kind; }

    /** Source line of the failure, or 0 when unknown (e.g. raised inside a builtin). */
    public int line() { return line; }

    public static final class LexError extends ScriptError {
        public LexError(int line, String message) { super(Kind.LEX, line, message); }
    }

    public static final class ParseError extends ScriptError {
        public ParseError(int line, String message) { super(Kind.PARSE, line, message); }
    }

    public static final class NameError extends ScriptError {
        public NameError(int line, String message) { super(Kind.NAME, line, message); }
    }

    public static final class TypeError extends ScriptError {
        public TypeError(int line, String message) { super(Kind.TYPE, line, message); }
    }

    public static final class ArityError extends ScriptError {
        public ArityError(int line, String message) { super(Kind.ARITY, line, message); }
    }

    public static final class ArithmeticError extends ScriptError {
        public ArithmeticError(int line, String message) { super(Kind.ARITHMETIC, line, message); }
    }

    public static final class ValueError extends ScriptError {
        public ValueError(int line, String message) { super(Kind.VALUE, line, message); }
    }
}
