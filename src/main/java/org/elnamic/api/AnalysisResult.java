package org.elnamic.api;

import org.elnamic.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * Findings of checking a program without running it.
 *
 * @param fileName The checked source.
 * @param diagnostics All errors and warnings in source order of discovery.
 */
public record AnalysisResult(String fileName, List<Diagnostic> diagnostics) {

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
