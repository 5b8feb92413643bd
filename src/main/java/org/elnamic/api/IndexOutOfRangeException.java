package org.elnamic.api;

/**
 * Raised when an array or string index is outside {@code [0, length)}.
 */
public class IndexOutOfRangeException extends EvaluationException {

    public IndexOutOfRangeException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "IndexError";
    }
}
