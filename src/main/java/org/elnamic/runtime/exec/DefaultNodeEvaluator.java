package org.elnamic.runtime.exec;

import org.elnamic.api.EvaluationException;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.runtime.model.Value;

/**
 * Default/fallback evaluator used when no specific evaluator is registered.
 * Reaching it means a node type was added to the parser without runtime support.
 */
public final class DefaultNodeEvaluator implements INodeEvaluator<AstNode> {

    @Override
    public Value evaluate(AstNode node, ExecutionContext ctx) {
        throw new EvaluationException("No evaluator registered for node type " + node.getClass().getSimpleName(),
                node.sourceInfo());
    }
}
