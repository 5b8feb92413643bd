package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

public class BreakAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        if (!context.isBreakAllowed()) {
            diagnostics.reportError("'break' outside of a loop or switch.", node.sourceInfo());
        }
    }
}
