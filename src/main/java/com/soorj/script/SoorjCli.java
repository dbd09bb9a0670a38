package com.soorj.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.soorj.debug.Debug;
import com.soorj.debug.DebugLevel;
import com.soorj.script.parser.ScriptError;

/**
 * Usage:
 *   java com.soorj.script.SoorjCli [--trace|--debug] [script-file]
 *
 * With a file: runs it once, only explicit {@code գրէ} calls produce output.
 * Without: starts the interactive loop.
 */
public final class SoorjCli {

    public static final int OK = 0;
    public static final int SCRIPT_ERROR = 1;
    public static final int USAGE = 2;
    public static final int UNREADABLE = 3;

    public static void main(String[] args) {
        int code = run(args, System.in, System.out, System.err);
        if (code != OK) System.exit(code);
    }

    public static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        Map<String, String> flags = new HashMap<String, String>();
        List<String> positional = new ArrayList<String>();
        parseArgs(args, flags, positional);

        if (flags.containsKey("trace")) Debug.get().useSysErr(DebugLevel.TRACE);
        else if (flags.containsKey("debug")) Debug.get().useSysErr(DebugLevel.DEBUG);

        if (positional.size() > 1) {
            err.println("Usage: SoorjCli [--trace|--debug] [script-file]");
            return USAGE;
        }

        SoorjScript engine = new SoorjScript();
        engine.setOut(out);

        if (positional.isEmpty()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
            try {
                new SoorjRepl(engine, reader, out).loop();
            } catch (IOException e) {
                err.println("Failed to read input: " + e.getMessage());
                return UNREADABLE;
            }
            return OK;
        }

        Path scriptPath = Path.of(positional.get(0));
        String script;
        try {
            script = Files.readString(scriptPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Failed to read script file: " + scriptPath);
            return UNREADABLE;
        }

        try {
            engine.run(script);
        } catch (ScriptError e) {
            err.println(e.kind().label + ": " + e.getMessage());
            return SCRIPT_ERROR;
        }
        return OK;
    }

    private static void parseArgs(String[] args, Map<String, String> flags, List<String> positional) {
        for (String a : args) {
            if (a.startsWith("--") && a.indexOf('=') >= 0) {
                int i = a.indexOf('=');
                flags.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                flags.put(a.substring(2), "true");
            } else {
                positional.add(a);
            }
        }
    }

    private SoorjCli() {}
}
