package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.control.DoWhileNode;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

public final class DoWhileEvaluator implements INodeEvaluator<DoWhileNode> {

    @Override
    public Value evaluate(DoWhileNode node, ExecutionContext ctx) {
        long iterations = 0;
        try {
            do {
                ctx.countIteration(++iterations, node.sourceInfo());
                ctx.executeIn(ctx.newChildScope(), node.body().statements());
            } while (ctx.evaluateTruth(node.condition(), "do-while condition").isTrue());
        } catch (BreakSignal signal) {
            // loop left
        }
        return UnitValue.INSTANCE;
    }
}
