package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.function.ReturnNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.exec.ReturnSignal;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

public final class ReturnEvaluator implements INodeEvaluator<ReturnNode> {

    @Override
    public Value evaluate(ReturnNode node, ExecutionContext ctx) {
        Value value = node.value() != null ? ctx.evaluate(node.value()) : UnitValue.INSTANCE;
        throw new ReturnSignal(value);
    }
}
