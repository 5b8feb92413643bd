package org.elnamic.api;

/**
 * Raised when a loop exceeds the configured iteration limit or calls nest deeper than allowed.
 */
public class ExecutionLimitException extends EvaluationException {

    public ExecutionLimitException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "ExecutionLimitError";
    }
}
