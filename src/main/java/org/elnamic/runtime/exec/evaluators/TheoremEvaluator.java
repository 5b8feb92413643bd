package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.proof.TheoremNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Registers the theorem. Its proposition is not evaluated until a proof completes.
 */
public final class TheoremEvaluator implements INodeEvaluator<TheoremNode> {

    @Override
    public Value evaluate(TheoremNode node, ExecutionContext ctx) {
        ctx.theorems().declareTheorem(node.name().text(), node.proposition(), node.sourceInfo());
        return UnitValue.INSTANCE;
    }
}
