package org.elnamic.runtime.builtins;

import org.elnamic.api.TypeMismatchException;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.runtime.model.RealValue;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

import java.util.ArrayList;
import java.util.List;

import static org.elnamic.runtime.builtins.BuiltinArguments.array;
import static org.elnamic.runtime.builtins.BuiltinArguments.integer;

/**
 * Console, collection and conversion builtins.
 */
final class CoreBuiltins {

    private CoreBuiltins() {
        // Utility class
    }

    static void registerAll(BuiltinRegistry registry) {
        registry.register("show", 1, (args, ctx, at) -> {
            ctx.services().console().show(args.get(0).toDisplayString());
            return UnitValue.INSTANCE;
        });

        registry.register("len", 1, (args, ctx, at) -> {
            Value value = args.get(0);
            if (value instanceof ArrayValue a) return new IntegerValue(a.size());
            if (value instanceof StringValue s) return new IntegerValue(s.length());
            throw new TypeMismatchException("'len' needs an array or string but got " + value.kindName(), at);
        });

        registry.register("append", 2, (args, ctx, at) -> {
            ArrayValue target = array(args, 0, "append", at);
            target.add(args.get(1));
            return target;
        });

        registry.register("range", 1, 2, (args, ctx, at) -> {
            long start = args.size() == 2 ? integer(args, 0, "range", at) : 0;
            long end = integer(args, args.size() - 1, "range", at);
            List<Value> elements = new ArrayList<>();
            for (long i = start; i < end; i++) {
                elements.add(new IntegerValue(i));
            }
            return new ArrayValue(elements);
        });

        registry.register("to_string", 1, (args, ctx, at) -> new StringValue(args.get(0).toDisplayString()));

        registry.register("to_integer", 1, (args, ctx, at) -> {
            Value value = args.get(0);
            if (value instanceof IntegerValue) return value;
            if (value instanceof RealValue r) return new IntegerValue((long) r.value());
            if (value instanceof StringValue s) {
                try {
                    return new IntegerValue(Long.parseLong(s.value().trim()));
                } catch (NumberFormatException e) {
                    throw new TypeMismatchException("Not an integer: \"" + s.value() + "\"", at);
                }
            }
            throw new TypeMismatchException("Cannot convert " + value.kindName() + " to integer", at);
        });

        registry.register("to_real", 1, (args, ctx, at) -> {
            Value value = args.get(0);
            if (value instanceof RealValue) return value;
            if (value instanceof IntegerValue i) return new RealValue(i.value());
            if (value instanceof StringValue s) {
                try {
                    return new RealValue(Double.parseDouble(s.value().trim()));
                } catch (NumberFormatException e) {
                    throw new TypeMismatchException("Not a real number: \"" + s.value() + "\"", at);
                }
            }
            throw new TypeMismatchException("Cannot convert " + value.kindName() + " to real", at);
        });

        registry.register("type_of", 1, (args, ctx, at) -> new StringValue(args.get(0).kindName()));

        registry.register("is_checked", 1, (args, ctx, at) ->
                Boolean3.of(ctx.theorems().isChecked(BuiltinArguments.string(args, 0, "is_checked", at))));
    }
}
