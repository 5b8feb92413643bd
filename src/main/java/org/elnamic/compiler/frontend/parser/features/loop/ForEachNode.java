package org.elnamic.compiler.frontend.parser.features.loop;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code for variable in iterable { body }}.
 *
 * @param keyword The {@code for} token.
 * @param variable The loop variable, bound afresh for every element.
 * @param iterable The array (or string) expression.
 * @param body The loop body.
 */
public record ForEachNode(Token keyword, Token variable, ExpressionNode iterable, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(iterable, body);
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
