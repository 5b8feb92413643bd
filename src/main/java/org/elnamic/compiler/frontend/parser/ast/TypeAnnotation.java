package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.runtime.model.TypeName;

/**
 * A declared type such as {@code integer} or {@code array[3]}.
 *
 * @param token The type name token.
 * @param type The type.
 * @param size The advisory size annotation, or {@code null}.
 */
public record TypeAnnotation(Token token, TypeName type, Long size) {
}
