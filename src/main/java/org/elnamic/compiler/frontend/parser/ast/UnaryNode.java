package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A prefix operation: {@code not}, {@code !}, {@code -} or {@code +}.
 *
 * @param operator The operator token.
 * @param operand The operand.
 */
public record UnaryNode(Token operator, ExpressionNode operand) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public SourceInfo sourceInfo() {
        return operator.sourceInfo();
    }
}
