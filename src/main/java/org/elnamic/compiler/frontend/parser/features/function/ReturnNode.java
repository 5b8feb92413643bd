package org.elnamic.compiler.frontend.parser.features.function;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code return [value];}
 *
 * @param keyword The {@code return} token.
 * @param value The returned expression, or {@code null} for the unit value.
 */
public record ReturnNode(Token keyword, ExpressionNode value) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return value != null ? List.of(value) : List.of();
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
