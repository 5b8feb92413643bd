package org.elnamic.compiler.frontend.parser.features.decl;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for {@code var} and {@code const}.
 * The syntax is <code>var a, b: type = expr;</code>; type and initializer are optional for
 * {@code var}, the initializer is required for {@code const}.
 */
public class VariableDeclarationHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();

        List<Token> names = new ArrayList<>();
        do {
            names.add(context.consume(TokenType.IDENTIFIER, "variable name"));
        } while (context.match(TokenType.COMMA));

        TypeAnnotation type = null;
        if (context.match(TokenType.COLON)) {
            type = context.typeAnnotation();
        }

        ExpressionNode initializer = null;
        if (keyword.type() == TokenType.CONST) {
            context.consume(TokenType.EQUAL, "'=' with an initial value for constant");
            initializer = context.expression();
        } else if (context.match(TokenType.EQUAL)) {
            initializer = context.expression();
        }

        context.consume(TokenType.SEMICOLON, "';' after declaration");
        return new VariableDeclarationNode(keyword, List.copyOf(names), type, initializer);
    }
}
