package com.soorj.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

import com.soorj.debug.Debug;
import com.soorj.script.parser.ScriptError;

/**
 * Interactive loop. Every line is one evaluation unit against a single persistent
 * {@link Session}; errors are reported and the loop keeps going.
 *
 * Commands: .help .example .env .clear .exit
 */
public final class SoorjRepl {

    static final String PROMPT = "soorj> ";
    // ANSI: cursor home, erase display
    static final String CLEAR_SCREEN = "\u001b[H\u001b[2J";

    private final Session session;
    private final BufferedReader in;
    private final PrintStream out;

    public SoorjRepl(SoorjScript engine, BufferedReader in, PrintStream out) {
        this.session = engine.newSession();
        this.in = in;
        this.out = out;
    }

    public Session session() { return session; }

    public void loop() throws IOException {
        out.println("Սուրճ (Soorj)");
        out.println("Type .help for help, .exit to quit");

        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) break; // EOF
            String cmd = line.trim();
            if (cmd.isEmpty()) continue;

            if (".exit".equals(cmd)) {
                break;
            } else if (".help".equals(cmd)) {
                printHelp();
            } else if (".example".equals(cmd)) {
                printExample();
            } else if (".clear".equals(cmd)) {
                out.print(CLEAR_SCREEN);
                out.flush();
            } else if (".env".equals(cmd)) {
                out.println(EnvironmentJson.pretty(session.bindings(), false));
            } else {
                evaluate(line);
            }
        }
        out.println("Ցտեսություն!");
    }

    /** Runs one unit and echoes each non-null bare expression value. */
    public void evaluate(String source) {
        try {
            session.execute(source, v -> {
                if (!v.isNull()) out.println(v.display());
            });
        } catch (ScriptError e) {
            out.println(e.kind().label + ": " + e.getMessage());
        } catch (RuntimeException e) {
            // host builtins may throw anything
            Debug.get().e("soorj.repl", "host failure", e);
            out.println("Error: " + e.getMessage());
        }
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  .help     show this message");
        out.println("  .example  show example programs");
        out.println("  .env      show session variables as JSON");
        out.println("  .clear    clear the screen");
        out.println("  .exit     quit");
        out.println();
        out.println("Keywords:");
        out.println("  եթե   if           հպ    else");
        out.println("  մինչև while        գործ  function");
        out.println("  տուր  return       այո   true");
        out.println("  ոչ    false        հեչ   null");
        out.println("  և     and          կամ   or");
        out.println("  չի    not");
        out.println();
        out.println("Builtins:");
        out.println("  " + SoorjScript.PRINT + "(...)  print values");
        out.println("  " + SoorjScript.TO_NUMBER + "(x)    convert to number");
        out.println("  " + SoorjScript.TO_STRING + "(x)    convert to string");
    }

    private void printExample() {
        out.println("ա = 10; բ = 20; գրէ(ա + բ)");
        out.println("ի = 1; մինչև ի <= 3 { գրէ(ի); ի = ի + 1 }");
        out.println("գործ աստիճան(հ, ց) { ա = 1; մինչև ց > 0 { ա = ա * հ; ց = ց - 1 }; տուր ա }");
        out.println("աստիճան(2, 3)");
    }
}
