package org.elnamic.compiler.frontend.parser;

import org.elnamic.api.ParseException;
import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides statement handlers with access to the token stream and to the shared
 * sub-parsers (statements, blocks, expressions) without coupling them to the {@link Parser}.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of the token after the current one without consuming anything.
     * @param type The token type to check.
     * @return true if the next token is of the given type, false otherwise.
     */
    boolean checkNext(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type.
     * If not, it reports an error and aborts parsing.
     * @param type The expected token type.
     * @param expected A description of what was expected, used in the error.
     * @return The consumed token.
     * @throws ParseException if the current token is of another type.
     */
    Token consume(TokenType type, String expected);

    /**
     * Reports an error at the current token and returns the exception to throw.
     * @param expected A description of what was expected.
     * @return The exception describing the mismatch.
     */
    ParseException error(String expected);

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /** Parses one statement of any kind. */
    AstNode statement();

    /** Parses an assignment, index assignment or expression without the trailing semicolon. */
    AstNode simpleStatement();

    /** Parses a brace-delimited block. */
    BlockNode block();

    /** Parses an expression. */
    ExpressionNode expression();

    /** Parses a type name with an optional {@code [size]} suffix. */
    TypeAnnotation typeAnnotation();
}
