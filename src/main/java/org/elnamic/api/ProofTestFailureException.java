package org.elnamic.api;

/**
 * Raised when a {@code test} statement inside a proof yields a different three-valued result
 * than the one it states.
 */
public class ProofTestFailureException extends EvaluationException {

    private final String label;

    public ProofTestFailureException(String label, String expected, String actual, SourceInfo sourceInfo) {
        super(String.format("Test '%s' failed: expected %s but was %s", label, expected, actual), sourceInfo);
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String getErrorName() {
        return "ProofTestFailure";
    }
}
