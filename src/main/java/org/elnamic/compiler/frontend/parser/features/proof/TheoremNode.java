package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.List;

/**
 * {@code theorem name: proposition;} states a proposition that a later proof may check.
 *
 * @param name The theorem name.
 * @param proposition The stated proposition; evaluated only when a proof completes.
 */
public record TheoremNode(Token name, ExpressionNode proposition) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(proposition);
    }

    @Override
    public SourceInfo sourceInfo() {
        return name.sourceInfo();
    }
}
