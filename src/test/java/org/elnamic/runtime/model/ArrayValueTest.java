package org.elnamic.runtime.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the display text of {@link ArrayValue}.
 */
public class ArrayValueTest {

    /**
     * Verifies that strings are quoted inside arrays and nested arrays are rendered in place.
     */
    @Test
    @Tag("unit")
    void testNestedDisplay() {
        // Arrange
        ArrayValue inner = new ArrayValue(List.of(new IntegerValue(1), new StringValue("x")));
        ArrayValue outer = new ArrayValue(List.of(inner, inner, Boolean3.UNKNOWN));

        // Act
        String text = outer.toDisplayString();

        // Assert
        assertThat(text).isEqualTo("[[1, \"x\"], [1, \"x\"], realistic]");
    }

    /**
     * Verifies that an array containing itself prints a placeholder instead of recursing.
     */
    @Test
    @Tag("unit")
    void testSelfContainingArray() {
        // Arrange
        ArrayValue array = new ArrayValue(List.of(new IntegerValue(1)));
        array.add(array);

        // Act
        String text = array.toDisplayString();

        // Assert
        assertThat(text).isEqualTo("[1, [...]]");
    }
}
