package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * {@code name = value;}
 *
 * @param name The assigned name.
 * @param value The new value.
 */
public record AssignmentNode(Token name, ExpressionNode value) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public SourceInfo sourceInfo() {
        return name.sourceInfo();
    }
}
