package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A binary operation. The operator token determines the operation.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryNode(ExpressionNode left, Token operator, ExpressionNode right) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public SourceInfo sourceInfo() {
        return operator.sourceInfo();
    }
}
