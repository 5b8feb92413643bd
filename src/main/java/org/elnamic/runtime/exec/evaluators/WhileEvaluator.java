package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.control.WhileNode;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

public final class WhileEvaluator implements INodeEvaluator<WhileNode> {

    @Override
    public Value evaluate(WhileNode node, ExecutionContext ctx) {
        long iterations = 0;
        try {
            while (ctx.evaluateTruth(node.condition(), "while condition").isTrue()) {
                ctx.countIteration(++iterations, node.sourceInfo());
                ctx.executeIn(ctx.newChildScope(), node.body().statements());
            }
        } catch (BreakSignal signal) {
            // loop left
        }
        return UnitValue.INSTANCE;
    }
}
