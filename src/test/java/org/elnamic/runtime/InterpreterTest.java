package org.elnamic.runtime;

import org.elnamic.api.ArityException;
import org.elnamic.api.ConstantAssignmentException;
import org.elnamic.api.DivisionByZeroException;
import org.elnamic.api.EvaluationException;
import org.elnamic.api.ExecutionLimitException;
import org.elnamic.api.IndexOutOfRangeException;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.api.UnboundNameException;
import org.elnamic.compiler.FrontendPipeline;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.runtime.model.Value;
import org.elnamic.test.utils.RecordingConsole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for program evaluation by the {@link Interpreter}: control flow, scoping,
 * closures and runtime errors.
 */
public class InterpreterTest {

    private final FrontendPipeline frontend = new FrontendPipeline();
    private RecordingConsole console;

    @BeforeEach
    void setUp() {
        console = new RecordingConsole();
    }

    private Interpreter interpreter(RuntimeOptions options) {
        return new Interpreter(RuntimeServices.defaults().withConsole(console), options);
    }

    private List<String> run(String source) {
        interpreter(RuntimeOptions.defaults()).execute(frontend.read(source, "test.el"));
        return console.lines();
    }

    /**
     * Verifies branch selection on a typed integer.
     */
    @Test
    @Tag("unit")
    void testIfElse() {
        // Act
        List<String> output = run("var x: integer = 15; if x > 10 { show \"big\"; } else { show \"small\"; }");

        // Assert
        assertThat(output).containsExactly("big");
    }

    /**
     * Verifies that an unknown condition selects neither an if branch nor a loop iteration.
     */
    @Test
    @Tag("unit")
    void testUnknownConditionIsNotTaken() {
        // Act
        List<String> output = run("""
                if realistic { show 1; } elif realistic or false { show 2; } else { show 3; }
                while realistic { show 4; }
                """);

        // Assert
        assertThat(output).containsExactly("3");
    }

    /**
     * Verifies that a name declared in a loop body is not visible after the loop.
     */
    @Test
    @Tag("unit")
    void testBlockScoping() {
        // Arrange
        String source = "var i = 0; while i < 2 { var inner = i; i = i + 1; } show inner;";

        // Act & Assert
        assertThatThrownBy(() -> run(source)).isInstanceOf(UnboundNameException.class)
                .hasMessageContaining("inner");
    }

    /**
     * Verifies that each for-each iteration gets a fresh scope, so redeclaring in the body is fine.
     */
    @Test
    @Tag("unit")
    void testForEachAccumulates() {
        // Act
        List<String> output = run("""
                var total = 0;
                for num in [1, 2, 3, 4, 5] { var doubled = num * 2; total = total + num; }
                show total;
                """);

        // Assert
        assertThat(output).containsExactly("15");
    }

    /**
     * Verifies the three-part for loop together with break.
     */
    @Test
    @Tag("unit")
    void testForWithBreak() {
        // Act
        List<String> output = run("for (var i = 0; i < 10; i = i + 1) { if i == 3 { break; } show i; }");

        // Assert
        assertThat(output).containsExactly("0", "1", "2");
    }

    /**
     * Verifies that a do-while body runs once even when the condition is false.
     */
    @Test
    @Tag("unit")
    void testDoWhileRunsOnce() {
        // Act
        List<String> output = run("var n = 0; do { n = n + 1; } while false; show n;");

        // Assert
        assertThat(output).containsExactly("1");
    }

    /**
     * Verifies stacked case labels, the default clause and that an unmatched switch does nothing.
     */
    @Test
    @Tag("unit")
    void testSwitch() {
        // Act
        List<String> output = run("""
                var grade = "B";
                switch grade { case "A": case "B": show "good"; case "C": show "ok"; default: show "other"; }
                switch 7 { case 1: show "one"; default: show "fallback"; }
                switch 9 { case 1: show "one"; }
                """);

        // Assert
        assertThat(output).containsExactly("good", "fallback");
    }

    /**
     * Verifies that a closure keeps its defining scope alive and mutates it across calls.
     */
    @Test
    @Tag("unit")
    void testClosureCapturesDefiningScope() {
        // Act
        List<String> output = run("""
                function makeCounter() {
                    var count = 0;
                    function increment() { count = count + 1; return count; }
                    return increment;
                }
                var counter = makeCounter();
                counter();
                show counter();
                """);

        // Assert
        assertThat(output).containsExactly("2");
    }

    /**
     * Verifies that free names in a function body resolve in the definition scope, not the caller's.
     */
    @Test
    @Tag("unit")
    void testLexicalNotDynamicScope() {
        // Act
        List<String> output = run("""
                var x = "global";
                function read() { return x; }
                function caller() { var x = "local"; return read(); }
                show caller();
                """);

        // Assert
        assertThat(output).containsExactly("global");
    }

    /**
     * Verifies recursion, typed parameters and the value of the last expression statement.
     */
    @Test
    @Tag("unit")
    void testRecursionAndResultValue() {
        // Arrange
        Interpreter interpreter = interpreter(RuntimeOptions.defaults());

        // Act
        Value result = interpreter.execute(frontend.read(
                "function fact(n: int) { if n <= 1 { return 1; } return n * fact(n - 1); } fact(10);", "test.el"));

        // Assert
        assertThat(result).isEqualTo(new IntegerValue(3_628_800));
        assertThat(interpreter.globals().lookup("fact")).isPresent();
    }

    /**
     * Verifies element assignment on nested arrays and string indexing.
     */
    @Test
    @Tag("unit")
    void testIndexing() {
        // Act
        List<String> output = run("""
                var grid = [[0, 0], [0, 0]];
                grid[1][0] = 5;
                show grid;
                show "hello"[1];
                """);

        // Assert
        assertThat(output).containsExactly("[[0, 0], [5, 0]]", "e");
    }

    /**
     * Verifies that an array size annotation is not enforced at runtime.
     */
    @Test
    @Tag("unit")
    void testArraySizeAnnotationIsIgnored() {
        // Act
        List<String> output = run("var a: array[3] = [1, 2]; show len(a); append(a, 3); append(a, 4); show len(a);");

        // Assert
        assertThat(output).containsExactly("2", "4");
    }

    /**
     * Verifies that length, indexing and iteration agree on characters outside the basic plane.
     */
    @Test
    @Tag("unit")
    void testStringsCountCodePoints() {
        // Arrange
        String smiley = "\uD83D\uDE00";

        // Act
        List<String> output = run("var s = \"a" + smiley + "b\"; show len(s); show s[1]; show s[2];"
                + " var n = 0; for c in s { n = n + 1; } show n;");

        // Assert
        assertThat(output).containsExactly("3", smiley, "b", "3");
    }

    /**
     * Verifies that reading past the end of an array fails instead of yielding a default.
     */
    @Test
    @Tag("unit")
    void testIndexOutOfRange() {
        assertThatThrownBy(() -> run("var a = [1, 2, 3]; show a[5];"))
                .isInstanceOf(IndexOutOfRangeException.class)
                .extracting(e -> ((IndexOutOfRangeException) e).getErrorName())
                .isEqualTo("IndexError");
    }

    /**
     * Verifies the runtime error kinds raised by ordinary statements.
     */
    @Test
    @Tag("unit")
    void testRuntimeErrors() {
        assertThatThrownBy(() -> run("const k = 1; k = 2;")).isInstanceOf(ConstantAssignmentException.class);
        assertThatThrownBy(() -> run("var n: integer = 1; n = \"x\";")).isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> run("show 1 / 0;")).isInstanceOf(DivisionByZeroException.class);
        assertThatThrownBy(() -> run("if 1 { }")).isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> run("function f(a) { } f(1, 2);")).isInstanceOf(ArityException.class);
        assertThatThrownBy(() -> run("var v = 1; v();")).isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> run("nothing();")).isInstanceOf(UnboundNameException.class);
    }

    /**
     * Verifies that output produced before an error stays visible.
     */
    @Test
    @Tag("unit")
    void testOutputBeforeErrorIsKept() {
        // Act & Assert
        assertThatThrownBy(() -> run("show \"before\"; show missing;")).isInstanceOf(EvaluationException.class);
        assertThat(console.lines()).containsExactly("before");
    }

    /**
     * Verifies that loops and recursion are bounded by the configured limits.
     */
    @Test
    @Tag("unit")
    void testExecutionLimits() {
        // Arrange
        Interpreter looping = interpreter(new RuntimeOptions(5, 500));
        Interpreter recursing = interpreter(new RuntimeOptions(0, 20));

        // Act & Assert
        assertThatThrownBy(() -> looping.execute(frontend.read("while true { }", "test.el")))
                .isInstanceOf(ExecutionLimitException.class);
        assertThatThrownBy(() -> recursing.execute(frontend.read("function f(n) { return f(n + 1); } f(0);", "test.el")))
                .isInstanceOf(ExecutionLimitException.class)
                .hasMessageContaining("'f'");
    }
}
