package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.ParameterNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

import java.util.HashSet;
import java.util.Set;

/**
 * Opens a function frame (so {@code return} becomes legal and enclosing loops stop counting
 * for {@code break}) and rejects repeated parameter names.
 */
public class FunctionAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        FunctionDeclarationNode function = (FunctionDeclarationNode) node;
        context.enter(AnalysisContext.Frame.FUNCTION);

        Set<String> names = new HashSet<>();
        for (ParameterNode parameter : function.parameters()) {
            if (!names.add(parameter.name().text())) {
                diagnostics.reportError("Parameter '" + parameter.name().text() + "' is declared twice in function '"
                        + function.name().text() + "'.", parameter.name().sourceInfo());
            }
        }
    }

    @Override
    public void afterChildren(AstNode node, AnalysisContext context) {
        context.leave();
    }
}
