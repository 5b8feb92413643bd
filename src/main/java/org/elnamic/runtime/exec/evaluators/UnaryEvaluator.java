package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.UnaryNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.exec.Operators;
import org.elnamic.runtime.model.Value;

public final class UnaryEvaluator implements INodeEvaluator<UnaryNode> {

    @Override
    public Value evaluate(UnaryNode node, ExecutionContext ctx) {
        return Operators.unary(node.operator(), ctx.evaluate(node.operand()));
    }
}
