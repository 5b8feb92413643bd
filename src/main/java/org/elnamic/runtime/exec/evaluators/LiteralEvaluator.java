package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.LiteralNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.Value;

public final class LiteralEvaluator implements INodeEvaluator<LiteralNode> {

    @Override
    public Value evaluate(LiteralNode node, ExecutionContext ctx) {
        return node.value();
    }
}
