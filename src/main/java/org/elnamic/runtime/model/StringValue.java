package org.elnamic.runtime.model;

import java.util.List;

/**
 * An immutable string. Length, indexing and iteration count Unicode code points.
 *
 * @param value The text.
 */
public record StringValue(String value) implements Value {

    /**
     * @return The number of code points.
     */
    public int length() {
        return value.codePointCount(0, value.length());
    }

    /**
     * @param index A code point index, already checked against {@link #length()}.
     * @return The code point at {@code index} as a one-character string.
     */
    public StringValue characterAt(int index) {
        int start = value.offsetByCodePoints(0, index);
        return new StringValue(new String(Character.toChars(value.codePointAt(start))));
    }

    /**
     * @return The code points in order, each as a one-character string.
     */
    public List<Value> characters() {
        return value.codePoints()
                .mapToObj(cp -> (Value) new StringValue(new String(Character.toChars(cp))))
                .toList();
    }

    @Override
    public String kindName() {
        return "string";
    }

    @Override
    public String toDisplayString() {
        return value;
    }
}
