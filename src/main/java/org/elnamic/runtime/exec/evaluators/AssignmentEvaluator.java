package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.AssignmentNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

public final class AssignmentEvaluator implements INodeEvaluator<AssignmentNode> {

    @Override
    public Value evaluate(AssignmentNode node, ExecutionContext ctx) {
        Value value = ctx.evaluate(node.value());
        ctx.environment().assign(node.name().text(), value, node.sourceInfo());
        return UnitValue.INSTANCE;
    }
}
