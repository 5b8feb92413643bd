package org.elnamic.compiler.frontend.parser.features.show;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code show value;} writes the canonical text of a value to the console as one line.
 *
 * @param keyword The {@code show} token.
 * @param value The shown expression.
 */
public record ShowNode(Token keyword, ExpressionNode value) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
