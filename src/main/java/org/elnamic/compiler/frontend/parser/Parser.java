package org.elnamic.compiler.frontend.parser;

import org.elnamic.api.ParseException;
import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.elnamic.compiler.frontend.parser.ast.AssignmentNode;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BinaryNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.CallNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.elnamic.compiler.frontend.parser.ast.IdentifierNode;
import org.elnamic.compiler.frontend.parser.ast.IndexAssignmentNode;
import org.elnamic.compiler.frontend.parser.ast.IndexNode;
import org.elnamic.compiler.frontend.parser.ast.LiteralNode;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;
import org.elnamic.compiler.frontend.parser.ast.UnaryNode;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.IntegerValue;
import org.elnamic.runtime.model.RealValue;
import org.elnamic.runtime.model.StringValue;
import org.elnamic.runtime.model.TypeName;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser for El. It consumes a list of tokens from the
 * {@link org.elnamic.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Statements introduced by a keyword are delegated to the handler registered for that keyword
 * in the {@link StatementHandlerRegistry}; assignments and expression statements as well as the
 * whole expression grammar are parsed here. Parsing stops at the first mismatch with a
 * {@link ParseException}; no partial tree is returned.
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final StatementHandlerRegistry statementRegistry;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an END_OF_FILE token.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.statementRegistry = StatementHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream. A leading {@code program NAME { ... }} header is optional;
     * without it the top-level statements form a program named {@value ProgramNode#DEFAULT_NAME}.
     * @return The program node.
     * @throws ParseException on the first token that does not fit the grammar.
     */
    public ProgramNode parse() {
        String fileName = peek().fileName();
        Token name = null;
        List<AstNode> statements = new ArrayList<>();

        if (match(TokenType.PROGRAM)) {
            name = consume(TokenType.IDENTIFIER, "program name");
            consume(TokenType.LEFT_BRACE, "'{' after program name");
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                statements.add(statement());
            }
            consume(TokenType.RIGHT_BRACE, "'}' to close program");
            if (!isAtEnd()) {
                throw error("end of input after program block");
            }
        } else {
            while (!isAtEnd()) {
                statements.add(statement());
            }
        }
        return new ProgramNode(name, statements, fileName);
    }

    @Override
    public AstNode statement() {
        Optional<IStatementHandler> handler = statementRegistry.get(peek().type());
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }
        if (check(TokenType.LEFT_BRACE)) {
            return block();
        }
        AstNode statement = simpleStatement();
        consume(TokenType.SEMICOLON, "';' after statement");
        return statement;
    }

    @Override
    public AstNode simpleStatement() {
        ExpressionNode expression = expression();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            ExpressionNode value = expression();
            if (expression instanceof IdentifierNode identifier) {
                return new AssignmentNode(identifier.identifierToken(), value);
            }
            if (expression instanceof IndexNode index) {
                return new IndexAssignmentNode(index.target(), index.index(), value, equals);
            }
            throw errorAt(equals, "assignable name or element before '='");
        }
        return new ExpressionStatementNode(expression);
    }

    @Override
    public BlockNode block() {
        Token open = consume(TokenType.LEFT_BRACE, "'{' to open block");
        List<AstNode> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "'}' to close block");
        return new BlockNode(open, statements);
    }

    @Override
    public TypeAnnotation typeAnnotation() {
        Token typeToken = consume(TokenType.TYPE_NAME, "type name");
        Long size = null;
        if (match(TokenType.LEFT_BRACKET)) {
            size = (Long) consume(TokenType.INTEGER, "array size").value();
            consume(TokenType.RIGHT_BRACKET, "']' after array size");
        }
        return new TypeAnnotation(typeToken, (TypeName) typeToken.value(), size);
    }

    // Expressions, loosest binding first.

    @Override
    public ExpressionNode expression() {
        return or();
    }

    private ExpressionNode or() {
        ExpressionNode expr = and();
        while (match(TokenType.OR, TokenType.OR_OR)) {
            Token operator = previous();
            expr = new BinaryNode(expr, operator, and());
        }
        return expr;
    }

    private ExpressionNode and() {
        ExpressionNode expr = equality();
        while (match(TokenType.AND, TokenType.AND_AND)) {
            Token operator = previous();
            expr = new BinaryNode(expr, operator, equality());
        }
        return expr;
    }

    private ExpressionNode equality() {
        ExpressionNode expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token operator = previous();
            expr = new BinaryNode(expr, operator, comparison());
        }
        return expr;
    }

    private ExpressionNode comparison() {
        ExpressionNode expr = term();
        while (match(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL)) {
            Token operator = previous();
            expr = new BinaryNode(expr, operator, term());
        }
        return expr;
    }

    private ExpressionNode term() {
        ExpressionNode expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = previous();
            expr = new BinaryNode(expr, operator, factor());
        }
        return expr;
    }

    private ExpressionNode factor() {
        ExpressionNode expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT, TokenType.DIV)) {
            Token operator = previous();
            expr = new BinaryNode(expr, operator, unary());
        }
        return expr;
    }

    private ExpressionNode unary() {
        if (match(TokenType.NOT, TokenType.BANG, TokenType.MINUS, TokenType.PLUS)) {
            Token operator = previous();
            return new UnaryNode(operator, unary());
        }
        return postfix();
    }

    private ExpressionNode postfix() {
        ExpressionNode expr = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                Token paren = previous();
                List<ExpressionNode> arguments = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_PAREN, "')' after arguments");
                expr = new CallNode(expr, paren, arguments);
            } else if (match(TokenType.LEFT_BRACKET)) {
                Token bracket = previous();
                ExpressionNode index = expression();
                consume(TokenType.RIGHT_BRACKET, "']' after index");
                expr = new IndexNode(expr, bracket, index);
            } else {
                return expr;
            }
        }
    }

    private ExpressionNode primary() {
        if (match(TokenType.INTEGER)) {
            return new LiteralNode(previous(), new IntegerValue((Long) previous().value()));
        }
        if (match(TokenType.REAL)) {
            return new LiteralNode(previous(), new RealValue((Double) previous().value()));
        }
        if (match(TokenType.STRING)) {
            return new LiteralNode(previous(), new StringValue((String) previous().value()));
        }
        if (match(TokenType.BOOLEAN)) {
            return new LiteralNode(previous(), (Boolean3) previous().value());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new IdentifierNode(previous());
        }
        if (match(TokenType.LEFT_BRACKET)) {
            Token bracket = previous();
            List<ExpressionNode> elements = new ArrayList<>();
            if (!check(TokenType.RIGHT_BRACKET)) {
                do {
                    elements.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_BRACKET, "']' after array elements");
            return new ArrayLiteralNode(bracket, elements);
        }
        if (match(TokenType.LEFT_PAREN)) {
            ExpressionNode inner = expression();
            consume(TokenType.RIGHT_PAREN, "')' after expression");
            return inner;
        }
        throw error("expression");
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.END_OF_FILE;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String expected) {
        if (check(type)) return advance();
        throw error(expected);
    }

    @Override
    public ParseException error(String expected) {
        return errorAt(peek(), expected);
    }

    private ParseException errorAt(Token token, String expected) {
        String found = token.type() == TokenType.END_OF_FILE ? "end of input" : token.text();
        ParseException exception = new ParseException(expected, found, token.sourceInfo());
        diagnostics.reportError(exception.getMessage(), token.sourceInfo());
        return exception;
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }
}
