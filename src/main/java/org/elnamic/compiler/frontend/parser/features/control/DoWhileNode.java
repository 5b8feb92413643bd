package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code do { body } while condition;}; the body runs at least once.
 *
 * @param keyword The {@code do} token.
 * @param body The loop body.
 * @param condition The condition tested after each iteration.
 */
public record DoWhileNode(Token keyword, BlockNode body, ExpressionNode condition) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body, condition);
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
