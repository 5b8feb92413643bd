package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code target[index] = value;} which replaces one element of an array in place.
 *
 * @param target The array expression.
 * @param index The index expression.
 * @param value The element value.
 * @param equals The assignment operator, used for positions.
 */
public record IndexAssignmentNode(ExpressionNode target, ExpressionNode index, ExpressionNode value, Token equals)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, index, value);
    }

    @Override
    public SourceInfo sourceInfo() {
        return target.sourceInfo();
    }
}
