package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;

/**
 * The completion marker of a proof.
 *
 * @param keyword The {@code QED} token.
 */
public record QedNode(Token keyword) implements AstNode {

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
