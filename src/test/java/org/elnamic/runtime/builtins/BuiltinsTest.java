package org.elnamic.runtime.builtins;

import org.elnamic.api.ArityException;
import org.elnamic.api.ScriptIOException;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.compiler.FrontendPipeline;
import org.elnamic.runtime.Interpreter;
import org.elnamic.runtime.RuntimeOptions;
import org.elnamic.runtime.RuntimeServices;
import org.elnamic.runtime.services.HeadlessTurtleSurface;
import org.elnamic.runtime.services.LocalFileSystem;
import org.elnamic.runtime.spi.IGraphicsSurface;
import org.elnamic.test.utils.RecordingConsole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the builtin functions registered by {@link BuiltinRegistry#initializeWithDefaults()}.
 */
public class BuiltinsTest {

    @TempDir
    Path tempDir;

    private final FrontendPipeline frontend = new FrontendPipeline();
    private RecordingConsole console;
    private IGraphicsSurface graphics;
    private RuntimeServices services;

    @BeforeEach
    void setUp() {
        console = new RecordingConsole();
        graphics = mock(IGraphicsSurface.class);
        services = new RuntimeServices(console, new LocalFileSystem(tempDir), graphics);
    }

    private List<String> run(String source) {
        return run(source, services);
    }

    private List<String> run(String source, RuntimeServices runtimeServices) {
        new Interpreter(runtimeServices, RuntimeOptions.defaults()).execute(frontend.read(source, "builtins.el"));
        return console.lines();
    }

    /**
     * Verifies the collection helpers, including that append mutates the array in place.
     */
    @Test
    @Tag("unit")
    void testCollections() {
        // Act
        List<String> output = run("""
                var a = [1, 2];
                append(a, 3);
                show len(a);
                show a;
                show range(3);
                show range(2, 5);
                show len("hello");
                """);

        // Assert
        assertThat(output).containsExactly("3", "[1, 2, 3]", "[0, 1, 2]", "[2, 3, 4]", "5");
    }

    /**
     * Verifies the conversion and introspection builtins.
     */
    @Test
    @Tag("unit")
    void testConversions() {
        // Act
        List<String> output = run("""
                show to_integer(" 42 ") + 1;
                show to_real(2);
                show to_string(realistic) + "!";
                show type_of([]);
                show type_of(1.5);
                """);

        // Assert
        assertThat(output).containsExactly("43", "2.0", "realistic!", "array", "real");
    }

    /**
     * Verifies that wrong argument counts and kinds are rejected.
     */
    @Test
    @Tag("unit")
    void testArgumentChecks() {
        assertThatThrownBy(() -> run("len();")).isInstanceOf(ArityException.class);
        assertThatThrownBy(() -> run("range(1, 2, 3);")).isInstanceOf(ArityException.class);
        assertThatThrownBy(() -> run("len(5);")).isInstanceOf(TypeMismatchException.class);
        assertThatThrownBy(() -> run("to_integer(\"abc\");")).isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("abc");
        assertThatThrownBy(() -> run("forward(\"far\");")).isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("forward");
    }

    /**
     * Verifies that a local binding shadows a builtin of the same name.
     */
    @Test
    @Tag("unit")
    void testLocalNameShadowsBuiltin() {
        // Act
        List<String> output = run("function len(x) { return \"mine\"; } show len([1]);");

        // Assert
        assertThat(output).containsExactly("mine");
    }

    /**
     * Verifies the proof query builtin.
     */
    @Test
    @Tag("unit")
    void testIsChecked() {
        // Act
        List<String> output = run("theorem t: true; show is_checked(\"t\"); proof t { QED } show is_checked(\"t\");");

        // Assert
        assertThat(output).containsExactly("false", "true");
    }

    /**
     * Verifies reading and writing files relative to the base directory.
     */
    @Test
    @Tag("unit")
    void testFileRoundTripThroughProgram() throws IOException {
        // Arrange
        Files.writeString(tempDir.resolve("in.txt"), "from disk", StandardCharsets.UTF_8);

        // Act
        List<String> output = run("show read_file(\"in.txt\"); write_file(\"out.txt\", [1, \"two\"]);");

        // Assert
        assertThat(output).containsExactly("from disk");
        assertThat(Files.readString(tempDir.resolve("out.txt"), StandardCharsets.UTF_8)).isEqualTo("[1, \"two\"]");
    }

    /**
     * Verifies that a missing file surfaces as an IO error.
     */
    @Test
    @Tag("unit")
    void testMissingFile() {
        assertThatThrownBy(() -> run("read_file(\"absent.txt\");"))
                .isInstanceOf(ScriptIOException.class)
                .hasMessageContaining("absent.txt");
    }

    /**
     * Verifies that turtle commands reach the surface in order with numeric arguments widened.
     */
    @Test
    @Tag("unit")
    void testTurtleCommands() {
        // Act
        run("penup(); goto(10, -5); pendown(); color(\"red\"); forward(50); right(90); circle(20); circle(20, 90);");

        // Assert
        var ordered = inOrder(graphics);
        ordered.verify(graphics).penUp();
        ordered.verify(graphics).goTo(10.0, -5.0);
        ordered.verify(graphics).penDown();
        ordered.verify(graphics).color("red");
        ordered.verify(graphics).forward(50.0);
        ordered.verify(graphics).right(90.0);
        ordered.verify(graphics).circle(20.0, null);
        ordered.verify(graphics).circle(20.0, 90.0);
    }

    /**
     * Verifies that position queries return reals from the surface.
     */
    @Test
    @Tag("unit")
    void testTurtleQueries() {
        // Arrange
        when(graphics.xcor()).thenReturn(3.0);
        when(graphics.heading()).thenReturn(90.0);

        // Act
        List<String> output = run("show xcor(); show heading();");

        // Assert
        assertThat(output).containsExactly("3.0", "90.0");
        verify(graphics).xcor();
    }

    /**
     * Verifies that event handlers are program functions called back with coordinates or keys.
     */
    @Test
    @Tag("unit")
    void testEventHandlers() {
        // Arrange
        HeadlessTurtleSurface surface = new HeadlessTurtleSurface();
        RuntimeServices headless = services.withGraphics(surface);
        run("""
                function clicked(x, y) { show "click " + x + "," + y; }
                function key(k) { show "key " + k; }
                on_click(clicked);
                on_key(key);
                """, headless);

        // Act
        surface.click(1.5, 2);
        surface.pressKey("space");

        // Assert
        assertThat(console.lines()).containsExactly("click 1.5,2.0", "key space");
    }
}
