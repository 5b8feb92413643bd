package org.elnamic.api;

import org.elnamic.compiler.diagnostics.Diagnostic;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when structural analysis finds errors that prevent a program from running.
 * All diagnostics of the analysis (warnings included) are kept for reporting.
 */
public class SemanticException extends ElException {

    private final List<Diagnostic> diagnostics;

    public SemanticException(List<Diagnostic> diagnostics) {
        super(summarize(diagnostics), firstErrorPosition(diagnostics));
        this.diagnostics = List.copyOf(diagnostics);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String getErrorName() {
        return "SemanticError";
    }

    private static String summarize(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::message)
                .collect(Collectors.joining("; "));
    }

    private static SourceInfo firstErrorPosition(List<Diagnostic> diagnostics) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .findFirst()
                .map(d -> new SourceInfo(d.fileName(), d.lineNumber(), d.columnNumber()))
                .orElse(SourceInfo.UNKNOWN);
    }
}
