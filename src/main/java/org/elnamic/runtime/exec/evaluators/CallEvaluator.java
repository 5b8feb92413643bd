package org.elnamic.runtime.exec.evaluators;

import org.elnamic.api.TypeMismatchException;
import org.elnamic.api.UnboundNameException;
import org.elnamic.compiler.frontend.parser.ast.CallNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.IdentifierNode;
import org.elnamic.runtime.builtins.Builtin;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.FunctionValue;
import org.elnamic.runtime.model.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Calls a closure or a builtin. A callee written as a bare name is looked up in the scope
 * chain first and in the builtin registry second.
 */
public final class CallEvaluator implements INodeEvaluator<CallNode> {

    @Override
    public Value evaluate(CallNode node, ExecutionContext ctx) {
        if (node.callee() instanceof IdentifierNode identifier) {
            Optional<Value> bound = ctx.environment().lookup(identifier.name());
            if (bound.isEmpty()) {
                Builtin builtin = ctx.builtins().find(identifier.name())
                        .orElseThrow(() -> new UnboundNameException(identifier.name(), identifier.sourceInfo()));
                return ctx.builtins().invoke(builtin, arguments(node, ctx), ctx, node.sourceInfo());
            }
            if (!(bound.get() instanceof FunctionValue function)) {
                throw new TypeMismatchException("'" + identifier.name() + "' is a " + bound.get().kindName()
                        + ", not a function", identifier.sourceInfo());
            }
            return ctx.callFunction(function, arguments(node, ctx), node.sourceInfo());
        }

        Value callee = ctx.evaluate(node.callee());
        if (!(callee instanceof FunctionValue function)) {
            throw new TypeMismatchException("Cannot call a " + callee.kindName(), node.sourceInfo());
        }
        return ctx.callFunction(function, arguments(node, ctx), node.sourceInfo());
    }

    private static List<Value> arguments(CallNode node, ExecutionContext ctx) {
        List<Value> values = new ArrayList<>(node.arguments().size());
        for (ExpressionNode argument : node.arguments()) {
            values.add(ctx.evaluate(argument));
        }
        return values;
    }
}
