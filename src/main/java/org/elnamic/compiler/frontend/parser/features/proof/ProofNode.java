package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * {@code proof name { ... }} for the theorem of the same name.
 * The body holds {@link HypothesisNode}s, {@link ProofTestNode}s, a {@link QedNode} and
 * ordinary expression or show statements.
 *
 * @param keyword The {@code proof} token.
 * @param theoremName The name of the theorem being proven.
 * @param body The proof statements in source order.
 */
public record ProofNode(Token keyword, Token theoremName, List<AstNode> body) implements AstNode {

    /**
     * @return Whether the body contains a completion marker.
     */
    public boolean hasCompletionMarker() {
        return body.stream().anyMatch(QedNode.class::isInstance);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }

    @Override
    public SourceInfo sourceInfo() {
        return keyword.sourceInfo();
    }
}
