package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code axiom name: proposition;} is accepted without proof and binds its truth value.
 *
 * @param name The axiom name.
 * @param proposition The proposition.
 */
public record AxiomNode(Token name, ExpressionNode proposition) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(proposition);
    }

    @Override
    public SourceInfo sourceInfo() {
        return name.sourceInfo();
    }
}
