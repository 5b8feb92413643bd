package org.elnamic.runtime.model;

/**
 * A runtime value of an El program.
 * <p>
 * The set of implementations is closed: {@link IntegerValue}, {@link RealValue},
 * {@link StringValue}, {@link Boolean3}, {@link ArrayValue}, {@link FunctionValue} and
 * {@link UnitValue}. Operators dispatch over these kinds
 * explicitly and reject every combination they do not define.
 */
public interface Value {

    /**
     * @return The name of this value's kind as shown in error messages, e.g. {@code integer}.
     */
    String kindName();

    /**
     * @return The canonical textual form used by {@code show} and string concatenation.
     */
    String toDisplayString();
}
