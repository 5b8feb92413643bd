package org.elnamic.api;

/**
 * Raised when a name is declared twice in the same scope, or a theorem/axiom name is reused.
 */
public class RedeclarationException extends EvaluationException {

    public RedeclarationException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "RedeclarationError";
    }
}
