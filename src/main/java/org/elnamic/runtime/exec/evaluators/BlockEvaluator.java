package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.Value;

/**
 * A free-standing block runs in its own child scope.
 */
public final class BlockEvaluator implements INodeEvaluator<BlockNode> {

    @Override
    public Value evaluate(BlockNode node, ExecutionContext ctx) {
        return ctx.executeIn(ctx.newChildScope(), node.statements());
    }
}
