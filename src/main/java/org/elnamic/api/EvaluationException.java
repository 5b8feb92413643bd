package org.elnamic.api;

/**
 * Common parent of all errors raised while a program is running, as opposed to
 * errors found while reading it.
 */
public class EvaluationException extends ElException {

    public EvaluationException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    public EvaluationException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, sourceInfo, cause);
    }

    @Override
    public String getErrorName() {
        return "RuntimeError";
    }
}
