package org.elnamic.api;

/**
 * Raised when a {@code const} binding is the target of an assignment.
 */
public class ConstantAssignmentException extends EvaluationException {

    public ConstantAssignmentException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "ConstantAssignmentError";
    }
}
