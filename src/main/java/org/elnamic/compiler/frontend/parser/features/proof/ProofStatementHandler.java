package org.elnamic.compiler.frontend.parser.features.proof;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code proof name { ... }}.
 * <p>
 * Inside the braces only hypotheses, tests, {@code QED}, {@code show} and expression statements
 * are allowed. A missing {@code QED} is not a syntax error; it is detected when the proof runs.
 */
public class ProofStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        Token theoremName = context.consume(TokenType.IDENTIFIER, "theorem name after 'proof'");
        context.consume(TokenType.LEFT_BRACE, "'{' to open proof");

        List<AstNode> body = new ArrayList<>();
        while (!context.check(TokenType.RIGHT_BRACE) && !context.isAtEnd()) {
            body.add(proofStatement(context));
        }
        context.consume(TokenType.RIGHT_BRACE, "'}' to close proof");
        return new ProofNode(keyword, theoremName, List.copyOf(body));
    }

    private AstNode proofStatement(ParsingContext context) {
        if (context.match(TokenType.HYPOTHESIS)) {
            Token name = context.consume(TokenType.IDENTIFIER, "hypothesis name");
            context.consume(TokenType.COLON, "':' after hypothesis name");
            ExpressionNode proposition = context.expression();
            context.consume(TokenType.SEMICOLON, "';' after hypothesis");
            return new HypothesisNode(name, proposition);
        }
        if (context.match(TokenType.TEST)) {
            Token label = context.consume(TokenType.IDENTIFIER, "test label");
            context.consume(TokenType.COLON, "':' after test label");
            ExpressionNode subject = context.expression();
            context.consume(TokenType.COLON, "':' before expected value");
            Token expected = context.consume(TokenType.BOOLEAN, "true, false or realistic as expected value");
            context.consume(TokenType.SEMICOLON, "';' after test");
            return new ProofTestNode(label, subject, expected);
        }
        if (context.match(TokenType.QED)) {
            Token qed = context.previous();
            context.match(TokenType.SEMICOLON);
            return new QedNode(qed);
        }
        if (context.check(TokenType.SHOW)) {
            return context.statement();
        }
        ExpressionNode expression = context.expression();
        context.consume(TokenType.SEMICOLON, "';' after proof step");
        return new ExpressionStatementNode(expression);
    }
}
