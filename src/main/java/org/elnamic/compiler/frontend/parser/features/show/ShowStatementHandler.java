package org.elnamic.compiler.frontend.parser.features.show;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

/**
 * Handler for {@code show expr;} and {@code SHOW expr;}. The call-like spelling
 * {@code show(expr);} parses as a parenthesized expression.
 */
public class ShowStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        ExpressionNode value = context.expression();
        context.consume(TokenType.SEMICOLON, "';' after show");
        return new ShowNode(keyword, value);
    }
}
