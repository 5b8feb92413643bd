package org.elnamic.runtime.model;

/**
 * The value of {@code return;}, of functions that finish without returning and of
 * declarations without an initializer.
 */
public enum UnitValue implements Value {
    INSTANCE;

    @Override
    public String kindName() {
        return "none";
    }

    @Override
    public String toDisplayString() {
        return "none";
    }
}
