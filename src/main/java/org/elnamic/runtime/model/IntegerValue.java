package org.elnamic.runtime.model;

/**
 * A 64-bit signed integer.
 *
 * @param value The numeric value.
 */
public record IntegerValue(long value) implements Value {

    @Override
    public String kindName() {
        return "integer";
    }

    @Override
    public String toDisplayString() {
        return Long.toString(value);
    }
}
