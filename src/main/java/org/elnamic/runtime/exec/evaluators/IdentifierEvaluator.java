package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.IdentifierNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.Value;

/**
 * Resolves a name through the scope chain. Builtins are not values; they are only found
 * by {@link CallEvaluator}.
 */
public final class IdentifierEvaluator implements INodeEvaluator<IdentifierNode> {

    @Override
    public Value evaluate(IdentifierNode node, ExecutionContext ctx) {
        return ctx.environment().get(node.name(), node.sourceInfo());
    }
}
