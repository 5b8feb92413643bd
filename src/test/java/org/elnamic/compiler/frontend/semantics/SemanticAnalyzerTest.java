package org.elnamic.compiler.frontend.semantics;

import org.elnamic.compiler.diagnostics.Diagnostic;
import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.lexer.Lexer;
import org.elnamic.compiler.frontend.parser.Parser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the structural checks of the {@link SemanticAnalyzer}.
 */
public class SemanticAnalyzerTest {

    private DiagnosticsEngine analyze(String source) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source, diagnostics, "test.el").scanTokens(), diagnostics);
        new SemanticAnalyzer(diagnostics).analyze(parser.parse());
        return diagnostics;
    }

    /**
     * Verifies that break is accepted in loops and switches but rejected elsewhere.
     */
    @Test
    @Tag("unit")
    void testBreakPlacement() {
        // Act
        DiagnosticsEngine valid = analyze("while true { break; } switch 1 { case 1: break; }");
        DiagnosticsEngine invalid = analyze("if true { break; }");

        // Assert
        assertThat(valid.hasErrors()).isFalse();
        assertThat(invalid.hasErrors()).isTrue();
        assertThat(invalid.getDiagnostics().get(0).message()).contains("'break' outside");
    }

    /**
     * Verifies that a function body does not inherit the enclosing loop for break.
     */
    @Test
    @Tag("unit")
    void testBreakInsideFunctionInsideLoop() {
        // Act
        DiagnosticsEngine diagnostics = analyze("while true { function f() { break; } break; }");

        // Assert
        assertThat(diagnostics.ofType(Diagnostic.Type.ERROR)).hasSize(1);
    }

    /**
     * Verifies that return is only accepted inside function bodies.
     */
    @Test
    @Tag("unit")
    void testReturnPlacement() {
        // Act
        DiagnosticsEngine valid = analyze("function f() { if true { return 1; } }");
        DiagnosticsEngine invalid = analyze("return 1;");

        // Assert
        assertThat(valid.hasErrors()).isFalse();
        assertThat(invalid.hasErrors()).isTrue();
    }

    /**
     * Verifies that two default clauses are an error and a repeated literal label is a warning.
     */
    @Test
    @Tag("unit")
    void testSwitchChecks() {
        // Act
        DiagnosticsEngine defaults = analyze("switch 1 { default: show 1; default: show 2; }");
        DiagnosticsEngine duplicates = analyze("switch 1 { case 1: show 1; case 1: show 2; }");

        // Assert
        assertThat(defaults.hasErrors()).isTrue();
        assertThat(duplicates.hasErrors()).isFalse();
        assertThat(duplicates.ofType(Diagnostic.Type.WARNING)).hasSize(1);
    }

    /**
     * Verifies that repeated parameter names are an error.
     */
    @Test
    @Tag("unit")
    void testDuplicateParameter() {
        assertThat(analyze("function f(a, a) { }").hasErrors()).isTrue();
    }

    /**
     * Verifies the proof checks: duplicate hypotheses are errors, a missing QED and steps after it are warnings.
     */
    @Test
    @Tag("unit")
    void testProofChecks() {
        // Act
        DiagnosticsEngine duplicate = analyze("theorem t: true; proof t { hypothesis h: true; hypothesis h: false; QED }");
        DiagnosticsEngine missingQed = analyze("theorem t: true; proof t { true; }");
        DiagnosticsEngine afterQed = analyze("theorem t: true; proof t { QED true; }");

        // Assert
        assertThat(duplicate.hasErrors()).isTrue();
        assertThat(missingQed.hasErrors()).isFalse();
        assertThat(missingQed.ofType(Diagnostic.Type.WARNING)).extracting(Diagnostic::message)
                .anyMatch(m -> m.contains("no QED"));
        assertThat(afterQed.ofType(Diagnostic.Type.WARNING)).extracting(Diagnostic::message)
                .anyMatch(m -> m.contains("after QED"));
    }

    /**
     * Verifies that a size annotation disagreeing with a literal initializer is only a warning.
     */
    @Test
    @Tag("unit")
    void testArraySizeMismatchWarning() {
        // Act
        DiagnosticsEngine diagnostics = analyze("var a: array[2] = [1, 2, 3];");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.ofType(Diagnostic.Type.WARNING)).hasSize(1);
    }

    /**
     * Verifies that theorems and axioms share one namespace for the duplicate warning.
     */
    @Test
    @Tag("unit")
    void testDuplicatePropositionName() {
        // Act
        DiagnosticsEngine diagnostics = analyze("axiom a: true; theorem a: true;");

        // Assert
        assertThat(diagnostics.ofType(Diagnostic.Type.WARNING)).hasSize(1);
    }
}
