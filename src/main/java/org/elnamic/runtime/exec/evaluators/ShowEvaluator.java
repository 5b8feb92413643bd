package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.show.ShowNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

public final class ShowEvaluator implements INodeEvaluator<ShowNode> {

    @Override
    public Value evaluate(ShowNode node, ExecutionContext ctx) {
        ctx.services().console().show(ctx.evaluate(node.value()).toDisplayString());
        return UnitValue.INSTANCE;
    }
}
