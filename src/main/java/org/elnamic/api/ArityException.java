package org.elnamic.api;

/**
 * Raised when a function is called with a different number of arguments than it declares.
 */
public class ArityException extends EvaluationException {

    private final String callee;
    private final int expected;
    private final int actual;

    public ArityException(String callee, int expected, int actual, SourceInfo sourceInfo) {
        super(String.format("Function '%s' expects %d argument(s) but got %d", callee, expected, actual), sourceInfo);
        this.callee = callee;
        this.expected = expected;
        this.actual = actual;
    }

    public String getCallee() { return callee; }
    public int getExpected() { return expected; }
    public int getActual() { return actual; }

    @Override
    public String getErrorName() {
        return "ArityError";
    }
}
