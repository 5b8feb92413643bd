package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.runtime.model.Value;

/**
 * A number, string or truth literal, already converted to its runtime value.
 *
 * @param token The literal token.
 * @param value The value it denotes.
 */
public record LiteralNode(Token token, Value value) implements ExpressionNode {

    @Override
    public SourceInfo sourceInfo() {
        return token.sourceInfo();
    }
}
