package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;

import java.util.List;

/**
 * An expression evaluated for its side effects (or, inside a proof, for its truth value).
 *
 * @param expression The expression.
 */
public record ExpressionStatementNode(ExpressionNode expression) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public SourceInfo sourceInfo() {
        return expression.sourceInfo();
    }
}
