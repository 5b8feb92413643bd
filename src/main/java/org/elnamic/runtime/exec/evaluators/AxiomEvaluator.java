package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.proof.AxiomNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.TypeName;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Evaluates the axiom, registers it and binds its name as a boolean constant.
 */
public final class AxiomEvaluator implements INodeEvaluator<AxiomNode> {

    @Override
    public Value evaluate(AxiomNode node, ExecutionContext ctx) {
        Boolean3 value = ctx.evaluateTruth(node.proposition(), "axiom");
        ctx.theorems().declareAxiom(node.name().text(), value, node.sourceInfo());
        ctx.environment().define(node.name().text(), value, TypeName.BOOLEAN, true, node.name().sourceInfo());
        return UnitValue.INSTANCE;
    }
}
