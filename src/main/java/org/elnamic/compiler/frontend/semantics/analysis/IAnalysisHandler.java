package org.elnamic.compiler.frontend.semantics.analysis;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.semantics.AnalysisContext;

/**
 * Interface for specialized handlers in semantic analysis.
 * Each handler is responsible for analyzing a specific type of AST node.
 */
@FunctionalInterface
public interface IAnalysisHandler {
    /**
     * Analyzes a single AST node before its children are visited.
     * @param node The node to analyze.
     * @param context The enclosing-construct state of the traversal.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(AstNode node, AnalysisContext context, DiagnosticsEngine diagnostics);

    /**
     * Called after the children of the node have been visited.
     * @param node The node whose subtree is complete.
     * @param context The enclosing-construct state of the traversal.
     */
    default void afterChildren(AstNode node, AnalysisContext context) {
    }
}
