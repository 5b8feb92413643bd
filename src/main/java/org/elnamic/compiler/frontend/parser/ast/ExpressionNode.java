package org.elnamic.compiler.frontend.parser.ast;

/**
 * Marker for AST nodes that produce a value when evaluated.
 */
public interface ExpressionNode extends AstNode {
}
