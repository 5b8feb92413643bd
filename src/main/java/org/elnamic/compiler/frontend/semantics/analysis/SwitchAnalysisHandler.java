package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.LiteralNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.CaseNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.SwitchNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;
import org.elnamic.runtime.model.Value;

import java.util.HashSet;
import java.util.Set;

/**
 * Rejects switches with more than one {@code default} clause and warns about literal case
 * values that can never match because an earlier label already has them.
 */
public class SwitchAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics) {
        SwitchNode switchNode = (SwitchNode) node;
        context.enter(AnalysisContext.Frame.SWITCH);

        long defaults = switchNode.cases().stream().filter(CaseNode::isDefault).count();
        if (defaults > 1) {
            diagnostics.reportError("Switch has " + defaults + " default clauses; at most one is allowed.", switchNode.sourceInfo());
        }

        Set<Value> seen = new HashSet<>();
        for (CaseNode caseNode : switchNode.cases()) {
            for (ExpressionNode label : caseNode.labels()) {
                if (label instanceof LiteralNode literal && !seen.add(literal.value())) {
                    diagnostics.reportWarning("Duplicate case value " + literal.token().text() + " is never selected.", literal.sourceInfo());
                }
            }
        }
    }

    @Override
    public void afterChildren(AstNode node, AnalysisContext context) {
        context.leave();
    }
}
