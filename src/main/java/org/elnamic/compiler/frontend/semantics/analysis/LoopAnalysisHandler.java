package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

/**
 * Marks the subtree of every loop form as a legal place for {@code break}.
 */
public class LoopAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        context.enter(AnalysisContext.Frame.LOOP);
    }

    @Override
    public void afterChildren(AstNode node, AnalysisContext context) {
        context.leave();
    }
}
