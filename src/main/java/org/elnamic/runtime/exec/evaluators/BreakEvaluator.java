package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.control.BreakNode;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.Value;

public final class BreakEvaluator implements INodeEvaluator<BreakNode> {

    @Override
    public Value evaluate(BreakNode node, ExecutionContext ctx) {
        throw BreakSignal.INSTANCE;
    }
}
