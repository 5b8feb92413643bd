package org.elnamic.api;

/**
 * Raised when a proof block ends without reaching {@code QED}.
 */
public class ProofIncompleteException extends EvaluationException {

    public ProofIncompleteException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "ProofIncompleteError";
    }
}
