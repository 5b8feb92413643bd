package org.elnamic.runtime.model;

import java.util.Map;
import java.util.Optional;

/**
 * The type names a declaration or parameter may be annotated with.
 * Several spellings map to the same type ({@code int} and {@code integer}, for example).
 */
public enum TypeName {
    INTEGER,
    REAL,
    STRING,
    BOOLEAN,
    ARRAY,
    OBJECT;

    private static final Map<String, TypeName> SPELLINGS = Map.of(
            "integer", INTEGER, "int", INTEGER,
            "real", REAL, "float", REAL,
            "string", STRING, "str", STRING,
            "boolean", BOOLEAN, "bool", BOOLEAN,
            "array", ARRAY,
            "object", OBJECT);

    /**
     * Looks up a type by one of its spellings.
     * @param spelling The text as written in source.
     * @return The type, or empty if the text is not a type name.
     */
    public static Optional<TypeName> fromSpelling(String spelling) {
        return Optional.ofNullable(SPELLINGS.get(spelling));
    }

    /**
     * Checks whether a value may be stored under this type without conversion.
     * Integers are accepted by {@link #REAL} and widened by {@link #coerce(Value)}.
     * @param value The value to check.
     * @return {@code true} if the value conforms.
     */
    public boolean accepts(Value value) {
        return switch (this) {
            case INTEGER -> value instanceof IntegerValue;
            case REAL -> value instanceof RealValue || value instanceof IntegerValue;
            case STRING -> value instanceof StringValue;
            case BOOLEAN -> value instanceof Boolean3;
            case ARRAY -> value instanceof ArrayValue;
            case OBJECT -> true;
        };
    }

    /**
     * Converts a conforming value to the representation this type stores.
     * @param value A value for which {@link #accepts(Value)} holds.
     * @return The stored value.
     */
    public Value coerce(Value value) {
        if (this == REAL && value instanceof IntegerValue i) {
            return new RealValue(i.value());
        }
        return value;
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
