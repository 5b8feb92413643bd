package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.CaseNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.SwitchNode;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.exec.Operators;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * Runs the body of the first clause with a label equal to the subject, or the default clause.
 * Bodies never fall through into the next clause. Labels are evaluated in order until one matches.
 */
public final class SwitchEvaluator implements INodeEvaluator<SwitchNode> {

    @Override
    public Value evaluate(SwitchNode node, ExecutionContext ctx) {
        Value subject = ctx.evaluate(node.subject());
        CaseNode selected = null;
        CaseNode fallback = null;
        search:
        for (CaseNode clause : node.cases()) {
            if (clause.isDefault() && fallback == null) {
                fallback = clause;
            }
            for (ExpressionNode label : clause.labels()) {
                if (Operators.equal(subject, ctx.evaluate(label)).isTrue()) {
                    selected = clause;
                    break search;
                }
            }
        }
        if (selected == null) {
            selected = fallback;
        }
        if (selected != null) {
            try {
                ctx.executeIn(ctx.newChildScope(), selected.body());
            } catch (BreakSignal signal) {
                // switch left
            }
        }
        return UnitValue.INSTANCE;
    }
}
