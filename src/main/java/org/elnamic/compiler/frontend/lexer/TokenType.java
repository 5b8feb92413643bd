package org.elnamic.compiler.frontend.lexer;

/**
 * Defines all possible token types that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Punctuation
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, SEMICOLON, COLON,

    // Operators
    PLUS, MINUS, STAR, SLASH, PERCENT,
    BANG, BANG_EQUAL, EQUAL, EQUAL_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    AND_AND, OR_OR,

    // Literals and names
    IDENTIFIER, STRING, INTEGER, REAL, BOOLEAN, TYPE_NAME,

    // Keywords
    PROGRAM, VAR, CONST, FUNCTION, RETURN,
    IF, ELIF, ELSE, WHILE, DO, FOR, IN, BREAK,
    SWITCH, CASE, DEFAULT, SHOW,
    THEOREM, AXIOM, PROOF, HYPOTHESIS, TEST, QED,
    AND, OR, NOT, DIV,

    // Special
    END_OF_FILE
}
