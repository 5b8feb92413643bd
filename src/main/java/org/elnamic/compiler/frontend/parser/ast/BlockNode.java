package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * A brace-delimited statement list; executing it introduces a new scope.
 *
 * @param openBrace The opening brace.
 * @param statements The statements of the block.
 */
public record BlockNode(Token openBrace, List<AstNode> statements) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }

    @Override
    public SourceInfo sourceInfo() {
        return openBrace.sourceInfo();
    }
}
