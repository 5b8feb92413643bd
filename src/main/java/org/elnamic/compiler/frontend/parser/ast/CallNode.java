package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A call expression.
 *
 * @param callee The expression naming the function, usually an {@link IdentifierNode}.
 * @param paren The opening parenthesis.
 * @param arguments The argument expressions in source order.
 */
public record CallNode(ExpressionNode callee, Token paren, List<ExpressionNode> arguments) implements ExpressionNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }

    @Override
    public SourceInfo sourceInfo() {
        return callee.sourceInfo();
    }
}
