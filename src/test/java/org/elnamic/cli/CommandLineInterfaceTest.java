package org.elnamic.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.elnamic.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the command-line entry point: exit codes and the text written to stdout and stderr.
 */
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        rootLevel = rootLogger().getLevel();
    }

    @AfterEach
    void tearDown() {
        rootLogger().setLevel(rootLevel);
        LoggingConfigurator.reset();
    }

    private static Logger rootLogger() {
        return ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    /**
     * Verifies that a file runs and its output goes to stdout.
     */
    @Test
    @Tag("integration")
    void testRunsFile() throws IOException {
        // Arrange
        Path file = write("big.el", "var x: integer = 15; if x > 10 { show \"big\"; } else { show \"small\"; }");

        // Act
        int exitCode = commandLine.execute(file.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString().trim()).isEqualTo("big");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies inline source and the proof summary flag.
     */
    @Test
    @Tag("integration")
    void testInlineSourceWithProofStatus() {
        // Act
        int exitCode = commandLine.execute("-e", "theorem t: true; proof t { QED } show 1 + 2;", "--proof-status");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("3").contains("1/1 theorem(s) checked");
    }

    /**
     * Verifies that a runtime error exits with 1 and is described on stderr after earlier output.
     */
    @Test
    @Tag("integration")
    void testRuntimeErrorExitCode() {
        // Act
        int exitCode = commandLine.execute("-e", "show \"first\"; show 1 / 0;");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("first");
        assertThat(err.toString()).contains("DivisionByZeroError at <inline>:1:");
    }

    /**
     * Verifies that configuration overrides reach the interpreter.
     */
    @Test
    @Tag("integration")
    void testConfigOverride() {
        // Act
        int exitCode = commandLine.execute("-Delnamic.runtime.max-loop-iterations=3", "-e", "while true { }");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("ExecutionLimitError");
    }

    /**
     * Verifies the usage errors.
     */
    @Test
    @Tag("integration")
    void testUsageErrors() throws IOException {
        // Arrange
        Path file = write("a.el", "show 1;");

        // Act & Assert
        assertThat(commandLine.execute()).isEqualTo(2);
        assertThat(commandLine.execute(file.toString(), "-e", "show 2;")).isEqualTo(2);
        assertThat(commandLine.execute("-c", tempDir.resolve("absent.conf").toString(), "-e", "show 1;")).isEqualTo(2);
        assertThat(err.toString()).contains("Invalid configuration");
    }

    /**
     * Verifies that an unreadable source file exits with 1.
     */
    @Test
    @Tag("integration")
    void testMissingSourceFile() {
        // Act
        int exitCode = commandLine.execute(tempDir.resolve("nope.el").toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("IOError");
    }

    /**
     * Verifies the check subcommand in text and JSON form.
     */
    @Test
    @Tag("integration")
    void testCheckCommand() throws IOException {
        // Arrange
        Path good = write("good.el", "show 1;");
        Path bad = write("bad.el", "break;");

        // Act
        int goodExit = commandLine.execute("check", good.toString());
        int badExit = commandLine.execute("check", "--json", bad.toString());
        int missingExit = commandLine.execute("check", tempDir.resolve("none.el").toString());

        // Assert
        assertThat(goodExit).isZero();
        assertThat(badExit).isEqualTo(1);
        assertThat(missingExit).isEqualTo(2);
        assertThat(out.toString())
                .contains(good + ": OK")
                .contains("\"ok\": false")
                .contains("\"type\": \"ERROR\"");
    }
}
