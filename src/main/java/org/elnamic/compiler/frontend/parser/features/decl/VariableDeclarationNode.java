package org.elnamic.compiler.frontend.parser.features.decl;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;

import java.util.List;

/**
 * A {@code var} or {@code const} declaration of one or more names.
 * Every name receives the value of the initializer, which is evaluated once.
 *
 * @param keyword The {@code var} or {@code const} token.
 * @param names The declared names.
 * @param type The declared type, or {@code null} if untyped.
 * @param initializer The initial value, or {@code null} (never for constants).
 */
public record VariableDeclarationNode(
        Token keyword,
        List<Token> names,
        TypeAnnotation type,
        ExpressionNode initializer
) implements AstNode {

    public boolean isConstant() {
        return keyword.type() == TokenType.CONST;
    }

    @Override
    public List<AstNode> getChildren() {
        return initializer != null ? List.of(initializer) : List.of();
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
