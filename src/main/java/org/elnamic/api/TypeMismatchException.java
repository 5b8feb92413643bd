package org.elnamic.api;

/**
 * Raised when an operator, condition, declaration or parameter receives a value of the wrong kind.
 */
public class TypeMismatchException extends EvaluationException {

    public TypeMismatchException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "TypeMismatchError";
    }
}
