package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.BinaryNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.exec.Operators;
import org.elnamic.runtime.model.Value;

/**
 * Evaluates both operands left to right, then applies the operator. Logical operators do not
 * short-circuit.
 */
public final class BinaryEvaluator implements INodeEvaluator<BinaryNode> {

    @Override
    public Value evaluate(BinaryNode node, ExecutionContext ctx) {
        Value left = ctx.evaluate(node.left());
        Value right = ctx.evaluate(node.right());
        return Operators.binary(node.operator(), left, right);
    }
}
