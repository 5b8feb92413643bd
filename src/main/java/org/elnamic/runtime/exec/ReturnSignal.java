package org.elnamic.runtime.exec;

import org.elnamic.runtime.model.Value;

/**
 * Unwinds to the innermost function call, carrying the returned value. Carries no stack trace.
 */
public final class ReturnSignal extends RuntimeException {

    private final transient Value value;

    public ReturnSignal(Value value) {
        super(null, null, false, false);
        this.value = value;
    }

    public Value value() {
        return value;
    }
}
