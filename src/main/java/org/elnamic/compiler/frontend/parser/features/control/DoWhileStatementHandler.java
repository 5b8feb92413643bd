package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

public class DoWhileStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        BlockNode body = context.block();
        context.consume(TokenType.WHILE, "'while' after do-block");
        ExpressionNode condition = context.expression();
        context.consume(TokenType.SEMICOLON, "';' after do-while condition");
        return new DoWhileNode(keyword, body, condition);
    }
}
