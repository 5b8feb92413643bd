package org.elnamic;

import org.elnamic.api.AnalysisResult;
import org.elnamic.api.ElException;
import org.elnamic.api.ExecutionResult;
import org.elnamic.api.IndexOutOfRangeException;
import org.elnamic.api.LexException;
import org.elnamic.api.ParseException;
import org.elnamic.api.SemanticException;
import org.elnamic.api.TheoremStatus;
import org.elnamic.runtime.RuntimeOptions;
import org.elnamic.runtime.RuntimeServices;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.test.utils.RecordingConsole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests: source text in, console output and proof results out.
 */
public class ElEngineTest {

    private RecordingConsole console;
    private ElEngine engine;

    @BeforeEach
    void setUp() {
        console = new RecordingConsole();
        engine = new ElEngine(RuntimeServices.defaults().withConsole(console), RuntimeOptions.defaults());
    }

    /**
     * Verifies that a typed declaration and an if/else print the selected branch only.
     */
    @Test
    @Tag("integration")
    void testBranchOutput() {
        // Act
        engine.run("var x: integer = 15;\nif x > 10 { show \"big\"; } else { show \"small\"; }", "branch.el");

        // Assert
        assertThat(console.lines()).containsExactly("big");
    }

    /**
     * Verifies that a theorem with a complete proof is reported as checked.
     */
    @Test
    @Tag("integration")
    void testTheoremChecked() {
        // Act
        ExecutionResult result = engine.run("theorem t: true; proof t { hypothesis h: true; true; QED; }", "proof.el");

        // Assert
        assertThat(result.isChecked("t")).isTrue();
        assertThat(result.theorems()).containsExactly(new TheoremStatus("t", true, "true", "true"));
        assertThat(result.proofsRun()).isEqualTo(1);
    }

    /**
     * Verifies that a for-each loop accumulates into an outer variable.
     */
    @Test
    @Tag("integration")
    void testForEachTotal() {
        // Act
        engine.run("""
                program Sum {
                    var total = 0;
                    for num in [1, 2, 3, 4, 5] { total = total + num; }
                    show total == 15;
                }
                """, "sum.el");

        // Assert
        assertThat(console.lines()).containsExactly("true");
    }

    /**
     * Verifies that an out-of-range index fails with an index error naming the position.
     */
    @Test
    @Tag("integration")
    void testIndexError() {
        assertThatThrownBy(() -> engine.run("var a = [1, 2, 3];\nshow a[5];", "index.el"))
                .isInstanceOf(IndexOutOfRangeException.class)
                .satisfies(e -> assertThat(((ElException) e).describe()).startsWith("IndexError at index.el:2:"));
    }

    /**
     * Verifies that each run starts from a fresh global scope.
     */
    @Test
    @Tag("integration")
    void testRunsAreIsolated() {
        // Arrange
        engine.run("var shared = 1;", "first.el");

        // Act & Assert
        assertThat(engine.run("var shared = 2; show shared;", "second.el").programName()).isEqualTo("main");
        assertThat(console.lines()).containsExactly("2");
    }

    /**
     * Verifies that frontend failures surface as their own error kinds and nothing runs.
     */
    @Test
    @Tag("integration")
    void testFrontendErrors() {
        assertThatThrownBy(() -> engine.run("show \"open;", "lex.el")).isInstanceOf(LexException.class);
        assertThatThrownBy(() -> engine.run("show 1 show 2;", "parse.el")).isInstanceOf(ParseException.class);
        assertThatThrownBy(() -> engine.run("show 1; break;", "sem.el")).isInstanceOf(SemanticException.class);
        assertThat(console.lines()).isEmpty();
    }

    /**
     * Verifies that checking reports diagnostics without running the program.
     */
    @Test
    @Tag("integration")
    void testCheckDoesNotRun() {
        // Act
        AnalysisResult clean = engine.check("show 1;", "clean.el");
        AnalysisResult broken = engine.check("return 1;", "broken.el");
        AnalysisResult unparsable = engine.check("var = ;", "unparsable.el");

        // Assert
        assertThat(clean.diagnostics()).isEmpty();
        assertThat(broken.hasErrors()).isTrue();
        assertThat(unparsable.hasErrors()).isTrue();
        assertThat(console.lines()).isEmpty();
    }

    /**
     * Verifies that a session keeps bindings and proofs across inputs, also after a failing one.
     */
    @Test
    @Tag("integration")
    void testSession() {
        // Arrange
        ScriptSession session = engine.openSession();

        // Act
        session.evaluate("var n = 4; theorem t: n > 3;");
        assertThatThrownBy(() -> session.evaluate("show n / 0;")).isInstanceOf(ElException.class);
        session.evaluate("proof t { QED }");

        // Assert
        assertThat(session.evaluate("n * 2;")).contains(new IntegerValue(8));
        assertThat(session.evaluate("show n;")).isEmpty();
        assertThat(session.status().isChecked("t")).isTrue();
        assertThat(console.lines()).containsExactly("4");
    }

    /**
     * Verifies running a program from a file path.
     */
    @Test
    @Tag("integration")
    void testRunPath(@TempDir Path tempDir) throws IOException {
        // Arrange
        Path file = tempDir.resolve("hello.el");
        Files.writeString(file, "program Hello { show \"hi\"; }");

        // Act
        ExecutionResult result = engine.run(file);

        // Assert
        assertThat(result.programName()).isEqualTo("Hello");
        assertThat(console.lines()).containsExactly("hi");
    }
}
