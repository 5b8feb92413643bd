package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

public class ReturnAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        if (!context.isInsideFunction()) {
            diagnostics.reportError("'return' outside of a function.", node.sourceInfo());
        }
    }
}
