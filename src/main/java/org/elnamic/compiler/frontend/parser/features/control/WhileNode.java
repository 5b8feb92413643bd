package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code while condition { body }}.
 *
 * @param keyword The {@code while} token.
 * @param condition The loop condition.
 * @param body The loop body.
 */
public record WhileNode(Token keyword, ExpressionNode condition, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
