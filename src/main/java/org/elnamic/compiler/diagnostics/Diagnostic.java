package org.elnamic.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * produced while reading or analyzing a program.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the source where the issue occurred.
 * @param lineNumber The line number of the issue.
 * @param columnNumber The column number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int columnNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents execution. */
        ERROR,
        /** A warning that does not prevent execution. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, columnNumber, message);
    }
}
