package org.elnamic.runtime.exec;

import org.elnamic.api.DivisionByZeroException;
import org.elnamic.api.IntegerOverflowException;
import org.elnamic.api.SourceInfo;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.FunctionValue;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.runtime.model.RealValue;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

import java.util.function.LongSupplier;

/**
 * The operator semantics of El. Every operator handles each value kind explicitly and
 * rejects unsupported combinations with a {@link TypeMismatchException}.
 */
public final class Operators {

    private Operators() {
        // Utility class
    }

    /**
     * Applies a binary operator.
     *
     * @param operator The operator token.
     * @param left The left operand value.
     * @param right The right operand value.
     * @return The result.
     */
    public static Value binary(Token operator, Value left, Value right) {
        SourceInfo at = operator.sourceInfo();
        return switch (operator.type()) {
            case PLUS -> add(left, right, at);
            case MINUS, STAR -> arithmetic(operator, left, right, at);
            case SLASH -> divide(left, right, at);
            case DIV -> integerDivide(left, right, at);
            case PERCENT -> modulo(left, right, at);
            case EQUAL_EQUAL -> equal(left, right);
            case BANG_EQUAL -> equal(left, right).not();
            case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> compare(operator, left, right, at);
            case AND, AND_AND -> truth(left, operator).and(truth(right, operator));
            case OR, OR_OR -> truth(left, operator).or(truth(right, operator));
            default -> throw new IllegalStateException("Not a binary operator: " + operator.text());
        };
    }

    /**
     * Applies a prefix operator.
     *
     * @param operator The operator token.
     * @param operand The operand value.
     * @return The result.
     */
    public static Value unary(Token operator, Value operand) {
        return switch (operator.type()) {
            case NOT, BANG -> truth(operand, operator).not();
            case MINUS -> {
                if (operand instanceof IntegerValue i) yield new IntegerValue(exact(() -> Math.negateExact(i.value()), "-", operator.sourceInfo()));
                if (operand instanceof RealValue r) yield new RealValue(-r.value());
                throw mismatch(operator, operand);
            }
            case PLUS -> {
                if (operand instanceof IntegerValue || operand instanceof RealValue) yield operand;
                throw mismatch(operator, operand);
            }
            default -> throw new IllegalStateException("Not a unary operator: " + operator.text());
        };
    }

    /**
     * Equality as used by {@code ==} and by switch label matching. Truth values follow the
     * three-valued rule; numbers compare numerically across integer and real; strings by content;
     * arrays and functions by identity; values of different kinds are unequal.
     *
     * @param left One value.
     * @param right The other value.
     * @return The truth of {@code left == right}.
     */
    public static Boolean3 equal(Value left, Value right) {
        if (left instanceof Boolean3 a && right instanceof Boolean3 b) {
            return a.equalTo(b);
        }
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            return Boolean3.of(a.value() == b.value());
        }
        if (isNumber(left) && isNumber(right)) {
            return Boolean3.of(toDouble(left) == toDouble(right));
        }
        if (left instanceof StringValue a && right instanceof StringValue b) {
            return Boolean3.of(a.value().equals(b.value()));
        }
        if (left instanceof ArrayValue || left instanceof FunctionValue || left instanceof UnitValue) {
            return Boolean3.of(left == right);
        }
        return Boolean3.FALSE;
    }

    public static boolean isNumber(Value value) {
        return value instanceof IntegerValue || value instanceof RealValue;
    }

    public static double toDouble(Value value) {
        if (value instanceof IntegerValue i) return i.value();
        if (value instanceof RealValue r) return r.value();
        throw new IllegalArgumentException("Not a number: " + value.kindName());
    }

    private static Value add(Value left, Value right, SourceInfo at) {
        if (left instanceof StringValue || right instanceof StringValue) {
            return new StringValue(left.toDisplayString() + right.toDisplayString());
        }
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            return new IntegerValue(exact(() -> Math.addExact(a.value(), b.value()), "+", at));
        }
        if (isNumber(left) && isNumber(right)) {
            return new RealValue(toDouble(left) + toDouble(right));
        }
        throw new TypeMismatchException(String.format("Cannot apply '+' to %s and %s", left.kindName(), right.kindName()), at);
    }

    private static Value arithmetic(Token operator, Value left, Value right, SourceInfo at) {
        requireNumbers(operator, left, right);
        boolean minus = operator.type() == TokenType.MINUS;
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            return new IntegerValue(exact(() -> minus ? Math.subtractExact(a.value(), b.value())
                    : Math.multiplyExact(a.value(), b.value()), operator.text(), at));
        }
        double x = toDouble(left);
        double y = toDouble(right);
        return new RealValue(minus ? x - y : x * y);
    }

    private static Value divide(Value left, Value right, SourceInfo at) {
        if (!isNumber(left) || !isNumber(right)) {
            throw new TypeMismatchException(String.format("Cannot apply '/' to %s and %s", left.kindName(), right.kindName()), at);
        }
        double divisor = toDouble(right);
        if (divisor == 0.0) {
            throw new DivisionByZeroException("Division by zero", at);
        }
        return new RealValue(toDouble(left) / divisor);
    }

    private static Value integerDivide(Value left, Value right, SourceInfo at) {
        if (!(left instanceof IntegerValue a) || !(right instanceof IntegerValue b)) {
            throw new TypeMismatchException(String.format("'div' needs two integers but got %s and %s", left.kindName(), right.kindName()), at);
        }
        if (b.value() == 0) {
            throw new DivisionByZeroException("Integer division by zero", at);
        }
        if (a.value() == Long.MIN_VALUE && b.value() == -1) {
            throw new IntegerOverflowException("Integer overflow in 'div'", at, null);
        }
        return new IntegerValue(Math.floorDiv(a.value(), b.value()));
    }

    private static Value modulo(Value left, Value right, SourceInfo at) {
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            if (b.value() == 0) {
                throw new DivisionByZeroException("Modulo by zero", at);
            }
            return new IntegerValue(Math.floorMod(a.value(), b.value()));
        }
        if (isNumber(left) && isNumber(right)) {
            double divisor = toDouble(right);
            if (divisor == 0.0) {
                throw new DivisionByZeroException("Modulo by zero", at);
            }
            return new RealValue(toDouble(left) % divisor);
        }
        throw new TypeMismatchException(String.format("Cannot apply '%%' to %s and %s", left.kindName(), right.kindName()), at);
    }

    private static Boolean3 compare(Token operator, Value left, Value right, SourceInfo at) {
        int order;
        if (left instanceof IntegerValue a && right instanceof IntegerValue b) {
            order = Long.compare(a.value(), b.value());
        } else if (isNumber(left) && isNumber(right)) {
            order = Double.compare(toDouble(left), toDouble(right));
        } else if (left instanceof StringValue a && right instanceof StringValue b) {
            order = a.value().compareTo(b.value());
        } else {
            throw new TypeMismatchException(String.format("Cannot compare %s and %s with '%s'",
                    left.kindName(), right.kindName(), operator.text()), at);
        }
        return Boolean3.of(switch (operator.type()) {
            case LESS -> order < 0;
            case LESS_EQUAL -> order <= 0;
            case GREATER -> order > 0;
            case GREATER_EQUAL -> order >= 0;
            default -> throw new IllegalStateException("Not a comparison: " + operator.text());
        });
    }

    private static Boolean3 truth(Value value, Token operator) {
        if (value instanceof Boolean3 truth) {
            return truth;
        }
        throw mismatch(operator, value);
    }

    private static void requireNumbers(Token operator, Value left, Value right) {
        if (!isNumber(left) || !isNumber(right)) {
            throw new TypeMismatchException(String.format("Cannot apply '%s' to %s and %s",
                    operator.text(), left.kindName(), right.kindName()), operator.sourceInfo());
        }
    }

    private static long exact(LongSupplier operation, String symbol, SourceInfo at) {
        try {
            return operation.getAsLong();
        } catch (ArithmeticException e) {
            throw new IntegerOverflowException("Integer overflow in '" + symbol + "'", at, e);
        }
    }

    private static TypeMismatchException mismatch(Token operator, Value operand) {
        return new TypeMismatchException(String.format("Cannot apply '%s' to %s", operator.text(), operand.kindName()),
                operator.sourceInfo());
    }
}
