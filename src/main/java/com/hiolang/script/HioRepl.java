package com.hiolang.script;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

import com.hiolang.script.parser.HioException;
import com.hiolang.script.parser.Value;

/**
 * Line-at-a-time interpreter session. Globals and functions defined on one
 * line stay visible to the following lines.
 */
public final class HioRepl {

    private final HioScript engine;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public HioRepl(HioScript engine, BufferedReader in, PrintStream out, PrintStream err) {
        this.engine = engine;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    // -----------------------------
    // REPL Loop
    // -----------------------------
    public void loop() throws IOException {
        HioScript.Session session = engine.newSession();

        out.println("Hiolang REPL v" + HioScript.VERSION);
        out.println("Type 'exit' to quit, 'help' for commands");
        out.println();

        while (true) {
            out.print("hio> ");
            out.flush();
            String line = in.readLine();
            if (line == null) break; // EOF
            line = line.trim();
            if (line.isEmpty()) continue;

            if ("exit".equals(line)) {
                out.println("Goodbye!");
                return;
            }
            if ("help".equals(line)) {
                printHelp();
                continue;
            }
            if ("clear".equals(line)) {
                out.print("\u001B[2J\u001B[1;1H");
                out.flush();
                continue;
            }

            try {
                Value result = session.eval(line);
                if (!result.isVoid()) out.println("=> " + result.display());
            } catch (HioException e) {
                err.println("Error: " + e.getMessage());
            }
        }
    }

    private void printHelp() {
        out.println("Commands:");
        out.println("  exit  - Exit the REPL");
        out.println("  help  - Show this message");
        out.println("  clear - Clear the screen");
    }
}
