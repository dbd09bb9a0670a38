package com.soorj.script;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

import com.soorj.debug.Debug;
import com.soorj.script.parser.Environment;
import com.soorj.script.parser.Lexer;
import com.soorj.script.parser.NativeFunction;
import com.soorj.script.parser.Parser;
import com.soorj.script.parser.ScriptError.ArityError;
import com.soorj.script.parser.ScriptError.ValueError;
import com.soorj.script.parser.Statement.Stmt;
import com.soorj.script.parser.Token;
import com.soorj.script.parser.Value;

/**
 * Core Soorj engine.
 *
 * - Armenian keywords (եթե / հպ / մինչև / գործ / տուր / այո / ոչ / հեչ / և / կամ / չի)
 * - Types: number (double), boolean, string, function, null
 * - Builtins bound in every session root:
 *     - գրէ(...)  writes its arguments, space separated, as one line
 *     - թիվ(x)    converts to number
 *     - բառ(x)    converts to string
 * - Host code may register further builtins with {@link #registerFunction}.
 *
 * One engine can serve many sessions; each {@link Session} owns its own root scope.
 */
public class SoorjScript {

    public static final String PRINT = "գրէ";
    public static final String TO_NUMBER = "թիվ";
    public static final String TO_STRING = "բառ";

    private static final String TAG = "soorj.engine";
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    /** Functional interface for built-in functions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private final Map<String, BuiltinFunction> functions = new LinkedHashMap<String, BuiltinFunction>();
    private PrintStream out = System.out;

    public SoorjScript() {
        registerCoreBuiltins();
    }

    /** Target of {@code գրէ}. Defaults to {@code System.out}. */
    public void setOut(PrintStream out) {
        this.out = (out == null) ? System.out : out;
    }

    public PrintStream getOut() { return out; }

    /** Registers (or replaces) a builtin; sessions created afterwards see it. */
    public void registerFunction(String name, BuiltinFunction fn) { functions.put(name, fn); }

    public List<Stmt> parse(String source) {
        List<Token> tokens = new Lexer(source).tokenize();
        return new Parser(tokens).parse();
    }

    public Session newSession() {
        Environment root = new Environment();
        for (Map.Entry<String, BuiltinFunction> e : functions.entrySet()) {
            root.define(e.getKey(), Value.func(new NativeFunction(e.getKey(), e.getValue())));
        }
        return new Session(this, root);
    }

    /**
     * File mode: runs {@code source} once in a fresh session and returns the root
     * bindings afterwards. Errors propagate to the caller.
     */
    public Map<String, Value> run(String source) {
        Session session = newSession();
        session.execute(source);
        return session.bindings();
    }

    /** Joins the canonical form of each value with a single space. */
    public static String render(List<Value> values) {
        StringJoiner sj = new StringJoiner(" ");
        for (Value v : values) sj.add(v.display());
        return sj.toString();
    }

    private void registerCoreBuiltins() {
        registerFunction(PRINT, args -> {
            out.println(render(args));
            return Value.nil();
        });

        registerFunction(TO_NUMBER, args -> {
            requireArgCount(TO_NUMBER, args, 1);
            Value v = args.get(0);
            switch (v.getType()) {
                case NUMBER:
                    return v;
                case STRING:
                    return Value.number(parseNumber(v.asString()));
                case BOOL:
                case FUNC:
                case NULL:
                    throw new ValueError(0, TO_NUMBER + "() cannot convert " + v.typeName() + " to number");
                default:
                    throw new IllegalStateException("Unknown value type: " + v.getType());
            }
        });

        registerFunction(TO_STRING, args -> {
            requireArgCount(TO_STRING, args, 1);
            Value v = args.get(0);
            return v.getType() == Value.Type.STRING ? v : Value.string(v.display());
        });

        Debug.get().d(TAG, "registered " + functions.size() + " core builtins");
    }

    private static double parseNumber(String text) {
        String s = text.trim();
        // plain decimal notation only, optional sign and exponent
        if (!DECIMAL.matcher(s).matches()) {
            throw new ValueError(0, TO_NUMBER + "() cannot parse '" + text + "' as a number");
        }
        return Double.parseDouble(s);
    }

    private static void requireArgCount(String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw new ArityError(0, name + "() expects " + expected + " argument" + (expected == 1 ? "" : "s")
                    + ", got " + args.size());
        }
    }
}
