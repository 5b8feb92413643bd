package org.elnamic.compiler.frontend.parser.features.loop;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

/**
 * Handler for both {@code for} forms. The header may be wrapped in parentheses.
 * An identifier directly followed by {@code in} selects the for-each form.
 */
public class ForStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        boolean parenthesized = context.match(TokenType.LEFT_PAREN);

        if (context.check(TokenType.IDENTIFIER) && context.checkNext(TokenType.IN)) {
            Token variable = context.advance();
            context.advance(); // in
            ExpressionNode iterable = context.expression();
            closeHeader(context, parenthesized);
            return new ForEachNode(keyword, variable, iterable, context.block());
        }

        AstNode initializer = null;
        if (context.check(TokenType.VAR)) {
            initializer = context.statement(); // consumes its own ';'
        } else if (!context.match(TokenType.SEMICOLON)) {
            initializer = context.simpleStatement();
            context.consume(TokenType.SEMICOLON, "';' after for-loop initializer");
        }

        ExpressionNode condition = null;
        if (!context.check(TokenType.SEMICOLON)) {
            condition = context.expression();
        }
        context.consume(TokenType.SEMICOLON, "';' after for-loop condition");

        AstNode step = null;
        TokenType headerEnd = parenthesized ? TokenType.RIGHT_PAREN : TokenType.LEFT_BRACE;
        if (!context.check(headerEnd)) {
            step = context.simpleStatement();
        }
        closeHeader(context, parenthesized);
        return new ForNode(keyword, initializer, condition, step, context.block());
    }

    private void closeHeader(ParsingContext context, boolean parenthesized) {
        if (parenthesized) {
            context.consume(TokenType.RIGHT_PAREN, "')' to close for-loop header");
        }
    }
}
