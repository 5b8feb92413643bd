package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code hypothesis name: proposition;}
 *
 * @param name The name the truth value is bound to.
 * @param proposition The proposition.
 */
public record HypothesisNode(Token name, ExpressionNode proposition) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(proposition);
    }

    @Override
    public SourceInfo sourceInfo() {
        return name.sourceInfo();
    }
}
