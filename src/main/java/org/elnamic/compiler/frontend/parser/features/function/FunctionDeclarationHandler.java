package org.elnamic.compiler.frontend.parser.features.function;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for <code>function name(a: integer, b) { }</code>.
 * Parameters may be separated by commas or semicolons.
 */
public class FunctionDeclarationHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        context.advance(); // function
        Token name = context.consume(TokenType.IDENTIFIER, "function name");
        context.consume(TokenType.LEFT_PAREN, "'(' after function name");

        List<ParameterNode> parameters = new ArrayList<>();
        if (!context.check(TokenType.RIGHT_PAREN)) {
            do {
                Token parameter = context.consume(TokenType.IDENTIFIER, "parameter name");
                TypeAnnotation type = context.match(TokenType.COLON) ? context.typeAnnotation() : null;
                parameters.add(new ParameterNode(parameter, type));
            } while (context.match(TokenType.COMMA, TokenType.SEMICOLON));
        }
        context.consume(TokenType.RIGHT_PAREN, "')' after parameters");

        return new FunctionDeclarationNode(name, List.copyOf(parameters), context.block());
    }
}
