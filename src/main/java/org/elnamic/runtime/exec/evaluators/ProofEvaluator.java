package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.features.proof.ProofNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;
import org.elnamic.runtime.proof.ProofChecker;

public final class ProofEvaluator implements INodeEvaluator<ProofNode> {

    private final ProofChecker checker = new ProofChecker();

    @Override
    public Value evaluate(ProofNode node, ExecutionContext ctx) {
        checker.check(node, ctx);
        return UnitValue.INSTANCE;
    }
}
