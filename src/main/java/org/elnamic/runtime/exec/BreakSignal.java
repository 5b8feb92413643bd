package org.elnamic.runtime.exec;

/**
 * Unwinds to the innermost loop or switch. Carries no stack trace.
 */
public final class BreakSignal extends RuntimeException {

    public static final BreakSignal INSTANCE = new BreakSignal();

    private BreakSignal() {
        super(null, null, false, false);
    }
}
