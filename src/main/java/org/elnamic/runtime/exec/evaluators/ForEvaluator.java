package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.loop.ForNode;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Counted loop. The initializer lives in a header scope that encloses every iteration; a
 * missing condition loops until {@code break}.
 */
public final class ForEvaluator implements INodeEvaluator<ForNode> {

    @Override
    public Value evaluate(ForNode node, ExecutionContext ctx) {
        return ctx.inScope(ctx.newChildScope(), () -> {
            if (node.initializer() != null) {
                ctx.evaluate(node.initializer());
            }
            long iterations = 0;
            try {
                while (node.condition() == null || ctx.evaluateTruth(node.condition(), "for condition").isTrue()) {
                    ctx.countIteration(++iterations, node.sourceInfo());
                    ctx.executeIn(ctx.newChildScope(), node.body().statements());
                    if (node.step() != null) {
                        ctx.evaluate(node.step());
                    }
                }
            } catch (BreakSignal signal) {
                // loop left
            }
            return UnitValue.INSTANCE;
        });
    }
}
