package org.elnamic.compiler.frontend.semantics;

import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.compiler.frontend.parser.features.control.BreakNode;
import org.elnamic.compiler.frontend.parser.features.control.DoWhileNode;
import org.elnamic.compiler.frontend.parser.features.control.WhileNode;
import org.elnamic.compiler.frontend.parser.features.decl.VariableDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.ReturnNode;
import org.elnamic.compiler.frontend.parser.features.loop.ForEachNode;
import org.elnamic.compiler.frontend.parser.features.loop.ForNode;
import org.elnamic.compiler.frontend.parser.features.proof.AxiomNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofNode;
import org.elnamic.compiler.frontend.parser.features.proof.TheoremNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.SwitchNode;
import org.elnamic.compiler.frontend.semantics.analysis.BreakAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.DeclarationAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.FunctionAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.LoopAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.ProofAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.ReturnAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.SwitchAnalysisHandler;
import org.elnamic.compiler.frontend.semantics.analysis.TheoremAnalysisHandler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Performs structural analysis on the AST before it runs: misplaced {@code break} and
 * {@code return}, malformed switches and proofs, advisory annotations.
 * It operates by traversing the AST and dispatching nodes to specific handlers.
 * Name resolution is left to the evaluator, which reports unbound names at run time.
 */
public class SemanticAnalyzer {

    private final DiagnosticsEngine diagnostics;
    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();

    /**
     * Constructs a new semantic analyzer.
     * @param diagnostics The diagnostics engine for reporting errors and warnings.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        registerDefaultHandlers();
    }

    private void registerDefaultHandlers() {
        LoopAnalysisHandler loops = new LoopAnalysisHandler();
        handlers.put(WhileNode.class, loops);
        handlers.put(DoWhileNode.class, loops);
        handlers.put(ForNode.class, loops);
        handlers.put(ForEachNode.class, loops);
        handlers.put(SwitchNode.class, new SwitchAnalysisHandler());
        handlers.put(FunctionDeclarationNode.class, new FunctionAnalysisHandler());
        handlers.put(BreakNode.class, new BreakAnalysisHandler());
        handlers.put(ReturnNode.class, new ReturnAnalysisHandler());
        handlers.put(VariableDeclarationNode.class, new DeclarationAnalysisHandler());
        handlers.put(ProofNode.class, new ProofAnalysisHandler());
        TheoremAnalysisHandler propositions = new TheoremAnalysisHandler();
        handlers.put(TheoremNode.class, propositions);
        handlers.put(AxiomNode.class, propositions);
    }

    /**
     * Analyzes a whole program. Findings are reported to the diagnostics engine.
     * @param program The program to analyze.
     */
    public void analyze(ProgramNode program) {
        traverseAndAnalyze(program.statements(), new AnalysisContext());
    }

    private void traverseAndAnalyze(List<AstNode> nodes, AnalysisContext context) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            IAnalysisHandler handler = handlers.get(node.getClass());
            if (handler != null) {
                handler.analyze(node, context, diagnostics);
            }
            traverseAndAnalyze(node.getChildren(), context);
            if (handler != null) {
                handler.afterChildren(node, context);
            }
        }
    }
}
