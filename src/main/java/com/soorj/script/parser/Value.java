package com.soorj.script.parser;

/**
 * Runtime value. Exactly one of five variants; every switch over {@link Type}
 * names all of them.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, FUNC, NULL }

    public static final String TRUE_LITERAL = "այո";
    public static final String FALSE_LITERAL = "ոչ";
    public static final String NULL_LITERAL = "հեչ";

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value func(Callee fn) { return new Value(Type.FUNC, fn); }
    public static Value nil() { return NIL; }

    public Type getType() { return type; }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + type);
        return (String) value;
    }

    public Callee asFunc() {
        if (type != Type.FUNC) throw new IllegalStateException("Expected function, got " + type);
        return (Callee) value;
    }

    public boolean isNull() { return type == Type.NULL; }

    /** {@code հեչ} and {@code ոչ} are falsy; everything else, 0 and "" included, is truthy. */
    public boolean isTruthy() {
        switch (type) {
            case NULL:
                return false;
            case BOOL:
                return asBool();
            case NUMBER:
            case STRING:
            case FUNC:
                return true;
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /** Language-level name of the variant, used in error messages. */
    public String typeName() {
        switch (type) {
            case NUMBER: return "number";
            case BOOL:   return "boolean";
            case STRING: return "string";
            case FUNC:   return "function";
            case NULL:   return "null";
            default:     throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    /** Canonical stringification, as written by {@code գրէ} and returned by {@code բառ}. */
    public String display() {
        switch (type) {
            case NUMBER:
                return Double.toString(asNumber());
            case BOOL:
                return asBool() ? TRUE_LITERAL : FALSE_LITERAL;
            case STRING:
                return asString();
            case FUNC:
                return asFunc().toString();
            case NULL:
                return NULL_LITERAL;
            default:
                throw new IllegalStateException("Unknown value type: " + type);
        }
    }

    @Override
    public String toString() {
        return type == Type.STRING ? '"' + asString() + '"' : display();
    }
}
