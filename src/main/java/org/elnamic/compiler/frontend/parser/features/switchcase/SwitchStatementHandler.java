package org.elnamic.compiler.frontend.parser.features.switchcase;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code switch}. Consecutive labels without statements between them are
 * stacked into one {@link CaseNode}; a body ends at the next label or the closing brace.
 */
public class SwitchStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        ExpressionNode subject = context.expression();
        context.consume(TokenType.LEFT_BRACE, "'{' after switch subject");

        List<CaseNode> cases = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            cases.add(parseClause(context));
        }
        context.consume(TokenType.RIGHT_BRACE, "'}' to close switch");
        return new SwitchNode(keyword, subject, List.copyOf(cases));
    }

    private CaseNode parseClause(ParsingContext context) {
        Token first = context.peek();
        List<ExpressionNode> labels = new ArrayList<>();
        boolean isDefault = false;

        do {
            if (context.match(TokenType.CASE)) {
                labels.add(context.expression());
                context.consume(TokenType.COLON, "':' after case value");
            } else if (context.match(TokenType.DEFAULT)) {
                isDefault = true;
                context.consume(TokenType.COLON, "':' after 'default'");
            } else {
                throw context.error("'case' or 'default'");
            }
        } while (context.check(TokenType.CASE) || context.check(TokenType.DEFAULT));

        List<AstNode> body = new ArrayList<>();
        while (!context.check(TokenType.CASE) && !context.check(TokenType.DEFAULT)
                && !context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            body.add(context.statement());
        }
        return new CaseNode(first, List.copyOf(labels), isDefault, List.copyOf(body));
    }
}
