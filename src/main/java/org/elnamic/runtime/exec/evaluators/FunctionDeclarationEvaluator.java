package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.FunctionValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Binds the function name in the current scope to a closure over that same scope, so the
 * function can call itself.
 */
public final class FunctionDeclarationEvaluator implements INodeEvaluator<FunctionDeclarationNode> {

    @Override
    public Value evaluate(FunctionDeclarationNode node, ExecutionContext ctx) {
        FunctionValue function = new FunctionValue(node, ctx.environment());
        ctx.environment().define(node.name().text(), function, node.name().sourceInfo());
        return UnitValue.INSTANCE;
    }
}
