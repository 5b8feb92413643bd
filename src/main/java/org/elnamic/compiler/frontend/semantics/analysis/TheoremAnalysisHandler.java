package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.features.proof.AxiomNode;
import org.elnamic.compiler.frontend.parser.features.proof.TheoremNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

/**
 * Warns about theorem and axiom names that are declared more than once.
 * The run-time registry rejects the second declaration.
 */
public class TheoremAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        Token name = node instanceof TheoremNode theorem ? theorem.name() : ((AxiomNode) node).name();
        if (!context.declareProposition(name.text())) {
            diagnostics.reportWarning("'" + name.text() + "' is already declared as a theorem or axiom.", name.sourceInfo());
        }
    }
}
