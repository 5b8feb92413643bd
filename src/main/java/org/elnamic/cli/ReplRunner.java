package org.elnamic.cli;

import org.elnamic.ScriptSession;
import org.elnamic.api.ElException;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;
import org.jline.reader.EndOfFileException;
import org.jline.reader.History;
import org.jline.reader.LineReader;
import org.jline.reader.UserInterruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;

/**
 * The interactive loop behind {@code elnamic -i}. Input lines are collected until their braces
 * balance and then run as one unit in the session; an error aborts only that unit.
 */
public class ReplRunner {

    private static final Logger log = LoggerFactory.getLogger(ReplRunner.class);
    private static final String CONTINUATION_PROMPT = "...> ";

    private final ScriptSession session;
    private final LineReader lineReader;
    private final PrintWriter out;
    private final String prompt;
    private final String version;

    public ReplRunner(ScriptSession session, LineReader lineReader, PrintWriter out, String prompt, String version) {
        this.session = session;
        this.lineReader = lineReader;
        this.out = out;
        this.prompt = prompt;
        this.version = version;
    }

    /**
     * Reads and runs inputs until {@code exit}, {@code quit} or end of input.
     * @return The exit code, always 0.
     */
    public int run() {
        out.println(version + " - type 'help' for commands");
        out.flush();
        StringBuilder pending = new StringBuilder();
        while (true) {
            String line;
            try {
                line = lineReader.readLine(pending.length() == 0 ? prompt : CONTINUATION_PROMPT);
            } catch (UserInterruptException e) {
                // Ctrl+C drops the pending input
                pending.setLength(0);
                out.println("Use 'exit' to quit");
                out.flush();
                continue;
            } catch (EndOfFileException e) {
                // Ctrl+D
                return 0;
            }
            if (line == null) {
                return 0;
            }

            if (pending.length() == 0) {
                String command = line.trim();
                if (command.isEmpty()) {
                    continue;
                }
                switch (command) {
                    case "exit", "quit" -> {
                        return 0;
                    }
                    case "help" -> {
                        printHelp();
                        continue;
                    }
                    case "version" -> {
                        out.println(version);
                        out.flush();
                        continue;
                    }
                    case "history" -> {
                        printHistory();
                        continue;
                    }
                    case "proofs" -> {
                        out.println(session.status().proofSummary());
                        out.flush();
                        continue;
                    }
                    default -> {
                        // El source
                    }
                }
            }

            pending.append(line).append('\n');
            if (braceDepth(pending) > 0) {
                continue;
            }
            String input = pending.toString();
            pending.setLength(0);
            runInput(input);
        }
    }

    private void runInput(String input) {
        try {
            session.evaluate(input).ifPresent(this::echo);
        } catch (ElException e) {
            out.println(e.describe());
            log.debug("REPL input failed", e);
        }
        out.flush();
    }

    private void echo(Value value) {
        if (value != UnitValue.INSTANCE) {
            out.println(value.toDisplayString());
        }
    }

    private void printHelp() {
        out.println("Available commands:");
        out.println("  help     - Show this help message.");
        out.println("  version  - Show the interpreter version.");
        out.println("  history  - Show the last inputs.");
        out.println("  proofs   - Show axioms, theorems and proofs of this session.");
        out.println("  exit     - Leave the REPL (also 'quit' or Ctrl+D).");
        out.println("Anything else is run as El source; open braces continue on the next line.");
        out.flush();
    }

    private void printHistory() {
        History history = lineReader.getHistory();
        if (history == null || history.isEmpty()) {
            out.println("No history available");
        } else {
            for (History.Entry entry : history) {
                out.printf("%4d  %s%n", entry.index() + 1, entry.line());
            }
        }
        out.flush();
    }

    /**
     * Counts unclosed braces, ignoring those inside string literals and line comments.
     */
    static int braceDepth(CharSequence text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '#' || (c == '/' && i + 1 < text.length() && text.charAt(i + 1) == '/')) {
                while (i < text.length() && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            }
        }
        return depth;
    }
}
