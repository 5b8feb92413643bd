package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

/**
 * Handler for <code>while c { }</code>, also written <code>while c do { }</code>.
 */
public class WhileStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        ExpressionNode condition = context.expression();
        context.match(TokenType.DO);
        return new WhileNode(keyword, condition, context.block());
    }
}
