package org.elnamic.runtime.builtins;

import org.elnamic.api.SourceInfo;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.model.Value;

import java.util.List;

/**
 * The body of a builtin. Arity has already been checked when it is invoked.
 */
@FunctionalInterface
public interface IBuiltinFunction {

    /**
     * @param args The evaluated arguments.
     * @param ctx The calling context, for services and callbacks.
     * @param callSite The position of the call, for errors.
     * @return The result; {@code UnitValue.INSTANCE} for commands.
     */
    Value call(List<Value> args, ExecutionContext ctx, SourceInfo callSite);
}
