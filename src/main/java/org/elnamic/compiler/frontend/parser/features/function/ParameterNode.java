package org.elnamic.compiler.frontend.parser.features.function;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.TypeAnnotation;

/**
 * A function parameter.
 *
 * @param name The parameter name.
 * @param type The declared type, or {@code null}.
 */
public record ParameterNode(Token name, TypeAnnotation type) {
}
