package org.elnamic.compiler.frontend.parser.features.switchcase;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * One clause of a switch: a stack of labels sharing one body.
 * <code>case "A": case "B": body</code> yields a single clause with two labels.
 *
 * @param keyword The first {@code case} or {@code default} token of the stack.
 * @param labels The case values in source order.
 * @param isDefault Whether {@code default} is among the stacked labels.
 * @param body The statements of the shared body.
 */
public record CaseNode(Token keyword, List<ExpressionNode> labels, boolean isDefault, List<AstNode> body)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(labels);
        children.addAll(body);
        return children;
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
