package org.elnamic.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public API and free of implementation details.
 *
 * @param fileName The logical name of the source (a path, or {@code <inline>} / {@code <repl>}).
 * @param lineNumber The 1-based line number.
 * @param columnNumber The 1-based column number.
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Position used when no source location is known. */
    public static final SourceInfo UNKNOWN = new SourceInfo("<unknown>", 0, 0);

    @Override
    public String toString() {
        return fileName + ":" + lineNumber + ":" + columnNumber;
    }
}
