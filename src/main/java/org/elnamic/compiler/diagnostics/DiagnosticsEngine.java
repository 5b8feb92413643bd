package org.elnamic.compiler.diagnostics;

import org.elnamic.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur while a program is lexed, parsed and analyzed.
 * <p>
 * This decouples error reporting from the actual frontend logic (parser, analyzer, etc.).
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message The error message.
     * @param source  The position the error refers to.
     */
    public void reportError(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, source.fileName(), source.lineNumber(), source.columnNumber()));
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param source  The position the warning refers to.
     */
    public void reportWarning(String message, SourceInfo source) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, source.fileName(), source.lineNumber(), source.columnNumber()));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the diagnostics of the given type only.
     *
     * @param type The type to filter by.
     * @return A new list containing the matching diagnostics.
     */
    public List<Diagnostic> ofType(Diagnostic.Type type) {
        return diagnostics.stream().filter(d -> d.type() == type).toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }
}
