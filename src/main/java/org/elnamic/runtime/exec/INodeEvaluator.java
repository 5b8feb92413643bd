package org.elnamic.runtime.exec;

import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.runtime.model.Value;

/**
 * Evaluates a specific AST node type.
 * <p>
 * Implementations should be stateless. All state (scopes, collaborators, limits) is reached
 * through the provided {@link ExecutionContext}. Statements return
 * {@link org.elnamic.runtime.model.UnitValue#INSTANCE} unless they have a natural value.
 *
 * @param <T> The concrete AST node type handled by this evaluator.
 */
@FunctionalInterface
public interface INodeEvaluator<T extends AstNode> {

    /**
     * Evaluates the given node.
     *
     * @param node The node to evaluate.
     * @param ctx The execution context.
     * @return The value of the node.
     */
    Value evaluate(T node, ExecutionContext ctx);
}
