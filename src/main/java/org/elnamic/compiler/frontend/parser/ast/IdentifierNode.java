package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

/**
 * A reference to a named binding.
 *
 * @param identifierToken The name token.
 */
public record IdentifierNode(Token identifierToken) implements ExpressionNode {

    public String name() {
        return identifierToken.text();
    }

    @Override
    public SourceInfo sourceInfo() {
        return identifierToken.sourceInfo();
    }
}
