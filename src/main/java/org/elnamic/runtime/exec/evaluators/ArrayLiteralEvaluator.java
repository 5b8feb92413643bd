package org.elnamic.runtime.exec.evaluators;

import org.elnamic.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.INodeEvaluator;
import org.elnamic.runtime.model.ArrayValue;
import org.elnamic.runtime.model.Value;

import java.util.ArrayList;
import java.util.List;

public final class ArrayLiteralEvaluator implements INodeEvaluator<ArrayLiteralNode> {

    @Override
    public Value evaluate(ArrayLiteralNode node, ExecutionContext ctx) {
        List<Value> elements = new ArrayList<>(node.elements().size());
        for (ExpressionNode element : node.elements()) {
            elements.add(ctx.evaluate(element));
        }
        return new ArrayValue(elements);
    }
}
