package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.control.IfNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Runs the first branch whose condition is true. An unknown condition counts as not true and
 * falls through to the next branch.
 */
public final class IfEvaluator implements INodeEvaluator<IfNode> {

    @Override
    public Value evaluate(IfNode node, ExecutionContext ctx) {
        for (IfNode.Branch branch : node.branches()) {
            if (ctx.evaluateTruth(branch.condition(), "if condition").isTrue()) {
                ctx.executeIn(ctx.newChildScope(), branch.body().statements());
                return UnitValue.INSTANCE;
            }
        }
        if (node.elseBranch() != null) {
            ctx.executeIn(ctx.newChildScope(), node.elseBranch().statements());
        }
        return UnitValue.INSTANCE;
    }
}
