package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

/**
 * Handler for <code>theorem name: expr;</code> and <code>axiom name: expr;</code>.
 */
public class TheoremStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        Token name = context.consume(TokenType.IDENTIFIER, keyword.text() + " name");
        context.consume(TokenType.COLON, "':' after " + keyword.text() + " name");
        ExpressionNode proposition = context.expression();
        context.consume(TokenType.SEMICOLON, "';' after " + keyword.text());

        if (keyword.type() == TokenType.AXIOM) {
            return new AxiomNode(name, proposition);
        }
        return new TheoremNode(name, proposition);
    }
}
