package org.elnamic.compiler.frontend.parser.features.function;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

public class ReturnStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        ExpressionNode value = context.check(TokenType.SEMICOLON) ? null : context.expression();
        context.consume(TokenType.SEMICOLON, "';' after return");
        return new ReturnNode(keyword, value);
    }
}
