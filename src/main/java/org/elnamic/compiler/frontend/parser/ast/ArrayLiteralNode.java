package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code [e1, e2, ...]}; each evaluation creates a new array.
 *
 * @param bracket The opening bracket.
 * @param elements The element expressions.
 */
public record ArrayLiteralNode(Token bracket, List<ExpressionNode> elements) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(elements);
    }

    @Override
    public SourceInfo sourceInfo() {
        return bracket.sourceInfo();
    }
}
