package org.elnamic.runtime.exec.evaluators;

import org.elnamic.api.TypeMismatchException;
import org.elnamic.compiler.frontend.parser.ast.IndexAssignmentNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

/**
 * {@code a[i] = v} replaces an element in place. Strings are immutable and rejected.
 */
public final class IndexAssignmentEvaluator implements INodeEvaluator<IndexAssignmentNode> {

    @Override
    public Value evaluate(IndexAssignmentNode node, ExecutionContext ctx) {
        Value target = ctx.evaluate(node.target());
        Value index = ctx.evaluate(node.index());
        Value value = ctx.evaluate(node.value());
        if (!(target instanceof ArrayValue array)) {
            throw new TypeMismatchException("Cannot assign an element of a " + target.kindName(), node.sourceInfo());
        }
        array.set(IndexEvaluator.checkedIndex(index, array.size(), node.sourceInfo()), value);
        return UnitValue.INSTANCE;
    }
}
