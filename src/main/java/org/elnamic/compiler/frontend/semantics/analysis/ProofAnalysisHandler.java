package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.features.proof.HypothesisNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofNode;
import org.elnamic.compiler.frontend.parser.features.proof.QedNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

import java.util.HashSet;
import java.util.Set;

/**
 * Checks the shape of a proof body: hypothesis names are unique, nothing follows {@code QED},
 * and a proof without {@code QED} is flagged ahead of the run-time failure.
 */
public class ProofAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        ProofNode proof = (ProofNode) node;
        Set<String> hypotheses = new HashSet<>();
        boolean completed = false;

        for (AstNode step : proof.body()) {
            if (completed) {
                diagnostics.reportWarning("Unreachable proof step after QED.", step.sourceInfo());
                break;
            }
            if (step instanceof HypothesisNode hypothesis && !hypotheses.add(hypothesis.name().text())) {
                diagnostics.reportError("Hypothesis '" + hypothesis.name().text() + "' is declared twice in proof '"
                        + proof.theoremName().text() + "'.", hypothesis.sourceInfo());
            }
            if (step instanceof QedNode) {
                completed = true;
            }
        }

        if (!completed) {
            diagnostics.reportWarning("Proof '" + proof.theoremName().text() + "' has no QED and cannot complete.", proof.sourceInfo());
        }
    }
}
