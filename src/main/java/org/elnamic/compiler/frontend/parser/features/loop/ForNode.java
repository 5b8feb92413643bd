package org.elnamic.compiler.frontend.parser.features.loop;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The counted form {@code for init; condition; step { body }}. Each part of the header is
 * optional; a missing condition counts as true.
 *
 * @param keyword The {@code for} token.
 * @param initializer A declaration, assignment or expression statement, or {@code null}.
 * @param condition The loop condition, or {@code null}.
 * @param step An assignment or expression statement run after each iteration, or {@code null}.
 * @param body The loop body.
 */
public record ForNode(Token keyword, AstNode initializer, ExpressionNode condition, AstNode step, BlockNode body)
        implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        if (initializer != null) children.add(initializer);
        if (condition != null) children.add(condition);
        if (step != null) children.add(step);
        children.add(body);
        return children;
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
