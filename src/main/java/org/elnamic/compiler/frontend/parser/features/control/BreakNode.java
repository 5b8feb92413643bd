package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;

/**
 * {@code break;} leaves the innermost loop or switch.
 *
 * @param keyword The {@code break} token.
 */
public record BreakNode(Token keyword) implements AstNode {

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
