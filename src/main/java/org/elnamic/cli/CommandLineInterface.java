package org.elnamic.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.elnamic.ElEngine;
import org.elnamic.ScriptSession;
import org.elnamic.api.ElException;
import org.elnamic.api.ExecutionResult;
import org.elnamic.cli.config.ConfigLoader;
import org.elnamic.cli.config.LoggingConfigurator;
import org.elnamic.runtime.RuntimeOptions;
import org.elnamic.runtime.RuntimeServices;
import org.elnamic.runtime.services.StdoutConsole;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * The command-line entry point of the El interpreter.
 * <p>
 * Runs a program file or inline source, optionally followed by an interactive session.
 * Exit codes: 0 on success, 1 when the program fails with an El error, 2 on usage errors.
 * </p>
 */
@Command(
    name = "elnamic",
    mixinStandardHelpOptions = true,
    version = CommandLineInterface.VERSION,
    description = "Runs programs written in the El language.",
    subcommands = { CheckCommand.class, CommandLine.HelpCommand.class }
)
public class CommandLineInterface implements Callable<Integer> {

    static final String VERSION = "El 1.0.0";

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "The El source file to run.")
    File file;

    @Option(names = {"-e", "--eval"}, description = "Run the given source text instead of a file.")
    String inlineSource;

    @Option(names = {"-i", "--interactive"}, description = "Start the REPL (after running FILE or -e, if given).")
    boolean interactive;

    @Option(names = {"-c", "--config"}, description = "Path to a HOCON configuration file.")
    File configFile;

    @Option(names = "-D", mapFallbackValue = "", description = "Override a configuration value, e.g. -Delnamic.runtime.max-call-depth=200")
    Map<String, String> configOverrides;

    @Option(names = "--proof-status", description = "Print the proof summary after the run.")
    boolean proofStatus;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (file != null && inlineSource != null) {
            err.println("Give either a FILE or -e SOURCE, not both.");
            return 2;
        }
        if (file == null && inlineSource == null && !interactive) {
            spec.commandLine().usage(err);
            return 2;
        }

        Config config;
        try {
            config = ConfigLoader.load(configFile, configOverrides);
        } catch (ConfigException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }
        LoggingConfigurator.configure(config);

        RuntimeServices services = RuntimeServices.defaults().withConsole(new StdoutConsole(out));
        ElEngine engine = new ElEngine(services, RuntimeOptions.fromConfig(config));
        boolean reportStatus = proofStatus || config.getBoolean("elnamic.proof.report-status");
        ScriptSession session = engine.openSession();

        if (file != null || inlineSource != null) {
            try {
                String source = inlineSource != null ? inlineSource : Files.readString(file.toPath(), StandardCharsets.UTF_8);
                String name = inlineSource != null ? "<inline>" : file.getPath();
                ExecutionResult result = interactive ? runInSession(session, source) : engine.run(source, name);
                if (reportStatus) {
                    out.println(result.proofSummary());
                }
            } catch (IOException e) {
                log.debug("Cannot read {}", file, e);
                err.println("IOError: cannot read " + file.getPath() + ": " + e.getMessage());
                return 1;
            } catch (ElException e) {
                log.debug("Program failed", e);
                out.flush();
                err.println(e.describe());
                return 1;
            } finally {
                out.flush();
            }
        }

        if (interactive) {
            return startRepl(session, config, out);
        }
        return 0;
    }

    private static ExecutionResult runInSession(ScriptSession session, String source) {
        session.evaluate(source);
        return session.status();
    }

    private int startRepl(ScriptSession session, Config config, PrintWriter out) {
        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            LineReader lineReader = LineReaderBuilder.builder()
                    .terminal(terminal)
                    .history(new DefaultHistory())
                    .build();
            return new ReplRunner(session, lineReader, out, config.getString("elnamic.repl.prompt"), VERSION).run();
        } catch (IOException e) {
            log.error("Cannot open the terminal: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * The main entry point for the CLI application.
     *
     * @param args The command-line arguments passed to the application.
     */
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }
}
