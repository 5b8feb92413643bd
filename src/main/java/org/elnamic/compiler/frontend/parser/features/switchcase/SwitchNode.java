package org.elnamic.compiler.frontend.parser.features.switchcase;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code switch subject { case ...: ... default: ... }}.
 *
 * @param keyword The {@code switch} token.
 * @param subject The value compared against the case labels.
 * @param cases The clauses in declaration order.
 */
public record SwitchNode(Token keyword, ExpressionNode subject, List<CaseNode> cases) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(subject);
        children.addAll(cases);
        return children;
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
