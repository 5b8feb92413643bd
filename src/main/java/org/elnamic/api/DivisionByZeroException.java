package org.elnamic.api;

/**
 * Raised by {@code /}, {@code div} and {@code %} when the divisor is zero.
 */
public class DivisionByZeroException extends EvaluationException {

    public DivisionByZeroException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "DivisionByZeroError";
    }
}
