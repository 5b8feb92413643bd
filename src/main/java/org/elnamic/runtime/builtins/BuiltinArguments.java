package org.elnamic.runtime.builtins;

import org.elnamic.api.SourceInfo;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.FunctionValue;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.runtime.model.RealValue;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.Value;

import java.util.List;

/**
 * Typed access to builtin arguments with uniform error messages.
 */
final class BuiltinArguments {

    private BuiltinArguments() {
        // Utility class
    }

    static double number(List<Value> args, int index, String builtin, SourceInfo at) {
        Value value = args.get(index);
        if (value instanceof IntegerValue i) return i.value();
        if (value instanceof RealValue r) return r.value();
        throw wrongKind(builtin, index, "number", value, at);
    }

    static long integer(List<Value> args, int index, String builtin, SourceInfo at) {
        Value value = args.get(index);
        if (value instanceof IntegerValue i) return i.value();
        throw wrongKind(builtin, index, "integer", value, at);
    }

    static String string(List<Value> args, int index, String builtin, SourceInfo at) {
        Value value = args.get(index);
        if (value instanceof StringValue s) return s.value();
        throw wrongKind(builtin, index, "string", value, at);
    }

    static ArrayValue array(List<Value> args, int index, String builtin, SourceInfo at) {
        Value value = args.get(index);
        if (value instanceof ArrayValue a) return a;
        throw wrongKind(builtin, index, "array", value, at);
    }

    static FunctionValue function(List<Value> args, int index, String builtin, SourceInfo at) {
        Value value = args.get(index);
        if (value instanceof FunctionValue f) return f;
        throw wrongKind(builtin, index, "function", value, at);
    }

    private static TypeMismatchException wrongKind(String builtin, int index, String expected, Value actual, SourceInfo at) {
        return new TypeMismatchException(String.format("Argument %d of '%s' must be a %s but was %s",
                index + 1, builtin, expected, actual.kindName()), at);
    }
}
