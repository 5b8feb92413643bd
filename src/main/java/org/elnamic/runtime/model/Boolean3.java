package org.elnamic.runtime.model;

/**
 * A Kleene three-valued truth value. {@link #UNKNOWN} is written {@code realistic} in source.
 */
public enum Boolean3 implements Value {
    TRUE("true"),
    FALSE("false"),
    UNKNOWN("realistic");

    private final String literal;

    Boolean3(String literal) {
        this.literal = literal;
    }

    /**
     * @param value A two-valued boolean.
     * @return {@link #TRUE} or {@link #FALSE}.
     */
    public static Boolean3 of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /** Swaps true and false; unknown stays unknown. */
    public Boolean3 not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    /** False if either side is false, unknown if either is unknown, true otherwise. */
    public Boolean3 and(Boolean3 other) {
        if (this == FALSE || other == FALSE) return FALSE;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return TRUE;
    }

    /** True if either side is true, unknown if either is unknown, false otherwise. */
    public Boolean3 or(Boolean3 other) {
        if (this == TRUE || other == TRUE) return TRUE;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return FALSE;
    }

    /**
     * Three-valued equality: identical values are equal, otherwise an unknown side makes
     * the result unknown, otherwise the values differ.
     *
     * @param other The value to compare with.
     * @return The truth of {@code this == other}.
     */
    public Boolean3 equalTo(Boolean3 other) {
        if (this == other) return TRUE;
        if (this == UNKNOWN || other == UNKNOWN) return UNKNOWN;
        return FALSE;
    }

    /**
     * @return {@code true} only for {@link #TRUE}; the branch-selection rule of conditions.
     */
    public boolean isTrue() {
        return this == TRUE;
    }

    public String literal() {
        return literal;
    }

    @Override
    public String kindName() {
        return "boolean";
    }

    @Override
    public String toDisplayString() {
        return literal;
    }
}
