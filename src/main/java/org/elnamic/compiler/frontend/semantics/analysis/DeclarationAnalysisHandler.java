package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;
import org.elnamic.compiler.frontend.parser.features.decl.VariableDeclarationNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

/**
 * Warns when an array size annotation disagrees with the element count of a literal initializer.
 * The annotation has no other effect.
 */
public class DeclarationAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        VariableDeclarationNode declaration = (VariableDeclarationNode) node;
        TypeAnnotation type = declaration.type();
        if (type == null || type.size() == null) {
            return;
        }
        if (declaration.initializer() instanceof ArrayLiteralNode literal && literal.elements().size() != type.size()) {
            diagnostics.reportWarning(String.format("Size annotation [%d] ignored: initializer has %d element(s).",
                    type.size(), literal.elements().size()), type.token().sourceInfo());
        }
    }
}
