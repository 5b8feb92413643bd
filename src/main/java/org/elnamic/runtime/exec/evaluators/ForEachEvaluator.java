package org.elnamic.runtime.exec.evaluators;

import org.elnamic.api.TypeMismatchException;
import org.elnamic.compiler.frontend.parser.features.loop.ForEachNode;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.Environment;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;

import java.util.List;

/**
 * {@code for x in items}. Iterates a snapshot of an array, or the characters of a string; each
 * iteration binds the loop variable in a fresh scope shared with the body.
 */
public final class ForEachEvaluator implements INodeEvaluator<ForEachNode> {

    @Override
    public Value evaluate(ForEachNode node, ExecutionContext ctx) {
        List<Value> items = items(ctx.evaluate(node.iterable()), node);
        long iterations = 0;
        try {
            for (Value item : items) {
                ctx.countIteration(++iterations, node.sourceInfo());
                Environment scope = ctx.newChildScope();
                scope.define(node.variable().text(), item, node.variable().sourceInfo());
                ctx.executeIn(scope, node.body().statements());
            }
        } catch (BreakSignal signal) {
            // loop left
        }
        return UnitValue.INSTANCE;
    }

    private static List<Value> items(Value iterable, ForEachNode node) {
        if (iterable instanceof ArrayValue array) {
            return array.snapshot();
        }
        if (iterable instanceof StringValue string) {
            return string.characters();
        }
        throw new TypeMismatchException("Cannot iterate over a " + iterable.kindName(), node.iterable().sourceInfo());
    }
}
