package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.Value;

/**
 * Yields the expression's value so that the REPL can echo it.
 */
public final class ExpressionStatementEvaluator implements INodeEvaluator<ExpressionStatementNode> {

    @Override
    public Value evaluate(ExpressionStatementNode node, ExecutionContext ctx) {
        return ctx.evaluate(node.expression());
    }
}
