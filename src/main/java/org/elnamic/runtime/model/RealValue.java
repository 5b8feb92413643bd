package org.elnamic.runtime.model;

/**
 * A double-precision floating point number.
 *
 * @param value The numeric value.
 */
public record RealValue(double value) implements Value {

    @Override
    public String kindName() {
        return "real";
    }

    @Override
    public String toDisplayString() {
        return Double.toString(value);
    }
}
