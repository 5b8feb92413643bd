package org.elnamic.compiler.frontend.parser;

import org.elnamic.compiler.frontend.parser.ast.AstNode;

/**
 * The base interface for all statement handlers.
 * Each handler is responsible for parsing the statements introduced by one keyword
 * (e.g., {@code while}); the keyword is still the current token when it is called.
 */
@FunctionalInterface
public interface IStatementHandler {

    /**
     * Parses the statement starting at the current token.
     *
     * @param context The context that provides access to the token stream and sub-parsers.
     * @return The AST node for the statement.
     */
    AstNode parse(ParsingContext context);
}
