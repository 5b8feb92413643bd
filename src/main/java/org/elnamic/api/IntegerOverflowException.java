package org.elnamic.api;

/**
 * Raised when integer arithmetic leaves the 64-bit signed range.
 */
public class IntegerOverflowException extends EvaluationException {

    public IntegerOverflowException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, sourceInfo, cause);
    }

    @Override
    public String getErrorName() {
        return "OverflowError";
    }
}
