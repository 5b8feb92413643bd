package org.elnamic.api;

/**
 * Raised when a name is read, assigned or called but no scope binds it
 * (and, for calls, no builtin carries it either).
 */
public class UnboundNameException extends EvaluationException {

    private final String name;

    public UnboundNameException(String name, SourceInfo sourceInfo) {
        super("Name '" + name + "' is not defined", sourceInfo);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public String getErrorName() {
        return "UnboundNameError";
    }
}
