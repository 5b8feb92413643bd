package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code target[index]}.
 *
 * @param target The indexed expression.
 * @param bracket The opening bracket.
 * @param index The index expression.
 */
public record IndexNode(ExpressionNode target, Token bracket, ExpressionNode index) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(target, index);
    }

    @Override
    public SourceInfo sourceInfo() {
        return bracket.sourceInfo();
    }
}
