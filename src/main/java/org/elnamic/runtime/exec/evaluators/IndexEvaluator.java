package org.elnamic.runtime.exec.evaluators;

import org.elnamic.api.IndexOutOfRangeException;
import org.elnamic.api.SourceInfo;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.compiler.frontend.parser.ast.IndexNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.Value;

/**
 * {@code target[index]} on arrays and strings. Indices are zero-based and never wrap.
 */
public final class IndexEvaluator implements INodeEvaluator<IndexNode> {

    @Override
    public Value evaluate(IndexNode node, ExecutionContext ctx) {
        Value target = ctx.evaluate(node.target());
        Value index = ctx.evaluate(node.index());
        SourceInfo at = node.sourceInfo();
        if (target instanceof ArrayValue array) {
            return array.get(checkedIndex(index, array.size(), at));
        }
        if (target instanceof StringValue string) {
            return string.characterAt(checkedIndex(index, string.length(), at));
        }
        throw new TypeMismatchException("Cannot index a " + target.kindName(), at);
    }

    /**
     * Validates an index value against a length.
     *
     * @return The index as an int.
     * @throws TypeMismatchException if the index is not an integer.
     * @throws IndexOutOfRangeException if it is negative or not below {@code length}.
     */
    static int checkedIndex(Value index, int length, SourceInfo at) {
        if (!(index instanceof IntegerValue integer)) {
            throw new TypeMismatchException("Index must be an integer but was " + index.kindName(), at);
        }
        if (integer.value() < 0 || integer.value() >= length) {
            throw new IndexOutOfRangeException("Index " + integer.value() + " out of range for length " + length, at);
        }
        return (int) integer.value();
    }
}
