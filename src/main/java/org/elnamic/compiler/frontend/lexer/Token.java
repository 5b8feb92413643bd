package org.elnamic.compiler.frontend.lexer;

import org.elnamic.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENTIFIER, INTEGER, WHILE).
 * @param text The exact text of the token from the source code.
 * @param value The decoded value of the token: a {@code Long}, {@code Double}, unescaped
 *              {@code String}, {@code Boolean3} or {@code TypeName}; {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical name of the source this token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {
    /**
     * @return The position of this token as API source information.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }
}
