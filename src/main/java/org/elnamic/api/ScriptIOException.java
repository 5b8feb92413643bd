package org.elnamic.api;

/**
 * Raised when a file builtin cannot read or write its target.
 */
public class ScriptIOException extends EvaluationException {

    public ScriptIOException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, sourceInfo, cause);
    }

    @Override
    public String getErrorName() {
        return "IOError";
    }
}
