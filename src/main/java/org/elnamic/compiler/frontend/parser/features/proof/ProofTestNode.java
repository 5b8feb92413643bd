package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.runtime.model.Boolean3;

import java.util.List;

/**
 * {@code test label: subject: expected;}
 *
 * @param label The test label.
 * @param subject The tested expression.
 * @param expected The truth literal the subject must evaluate to.
 */
public record ProofTestNode(Token label, ExpressionNode subject, Token expected) implements AstNode {

    public Boolean3 expectedValue() {
        return (Boolean3) expected.value();
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(subject);
    }

    @Override
    public SourceInfo sourceInfo() {
        return label.sourceInfo();
    }
}
