package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;

public class BreakStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        context.consume(TokenType.SEMICOLON, "';' after 'break'");
        return new BreakNode(keyword);
    }
}
