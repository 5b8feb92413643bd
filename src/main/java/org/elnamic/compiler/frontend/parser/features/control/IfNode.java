package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code if} statement with its {@code elif} branches and optional {@code else}.
 *
 * @param keyword The {@code if} token.
 * @param branches The conditional branches in test order; never empty.
 * @param elseBranch The block run when no condition is true, or {@code null}.
 */
public record IfNode(Token keyword, List<Branch> branches, BlockNode elseBranch) implements AstNode {

    /**
     * One condition and the block it guards.
     *
     * @param condition The condition.
     * @param body The guarded block.
     */
    public record Branch(ExpressionNode condition, BlockNode body) {
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        for (Branch branch : branches) {
            children.add(branch.condition());
            children.add(branch.body());
        }
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
