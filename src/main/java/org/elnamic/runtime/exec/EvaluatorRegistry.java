package org.elnamic.runtime.exec;

import org.elnamic.compiler.frontend.parser.ast.ArrayLiteralNode;
import org.elnamic.compiler.frontend.parser.ast.AssignmentNode;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BinaryNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;
import org.elnamic.compiler.frontend.parser.ast.CallNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.elnamic.compiler.frontend.parser.ast.IdentifierNode;
import org.elnamic.compiler.frontend.parser.ast.IndexAssignmentNode;
import org.elnamic.compiler.frontend.parser.ast.IndexNode;
import org.elnamic.compiler.frontend.parser.ast.LiteralNode;
import org.elnamic.compiler.frontend.parser.ast.UnaryNode;
import org.elnamic.compiler.frontend.parser.features.control.BreakNode;
import org.elnamic.compiler.frontend.parser.features.control.DoWhileNode;
import org.elnamic.compiler.frontend.parser.features.control.IfNode;
import org.elnamic.compiler.frontend.parser.features.control.WhileNode;
import org.elnamic.compiler.frontend.parser.features.decl.VariableDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.ReturnNode;
import org.elnamic.compiler.frontend.parser.features.loop.ForEachNode;
import org.elnamic.compiler.frontend.parser.features.loop.ForNode;
import org.elnamic.compiler.frontend.parser.features.proof.AxiomNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofNode;
import org.elnamic.compiler.frontend.parser.features.proof.TheoremNode;
import org.elnamic.compiler.frontend.parser.features.show.ShowNode;
import org.elnamic.compiler.frontend.parser.features.switchcase.SwitchNode;
import org.elnamic.runtime.exec.evaluators.ArrayLiteralEvaluator;
import org.elnamic.runtime.exec.evaluators.AssignmentEvaluator;
import org.elnamic.runtime.exec.evaluators.AxiomEvaluator;
import org.elnamic.runtime.exec.evaluators.BinaryEvaluator;
import org.elnamic.runtime.exec.evaluators.BlockEvaluator;
import org.elnamic.runtime.exec.evaluators.BreakEvaluator;
import org.elnamic.runtime.exec.evaluators.CallEvaluator;
import org.elnamic.runtime.exec.evaluators.DoWhileEvaluator;
import org.elnamic.runtime.exec.evaluators.ExpressionStatementEvaluator;
import org.elnamic.runtime.exec.evaluators.ForEachEvaluator;
import org.elnamic.runtime.exec.evaluators.ForEvaluator;
import org.elnamic.runtime.exec.evaluators.FunctionDeclarationEvaluator;
import org.elnamic.runtime.exec.evaluators.IdentifierEvaluator;
import org.elnamic.runtime.exec.evaluators.IfEvaluator;
import org.elnamic.runtime.exec.evaluators.IndexAssignmentEvaluator;
import org.elnamic.runtime.exec.evaluators.IndexEvaluator;
import org.elnamic.runtime.exec.evaluators.LiteralEvaluator;
import org.elnamic.runtime.exec.evaluators.ProofEvaluator;
import org.elnamic.runtime.exec.evaluators.ReturnEvaluator;
import org.elnamic.runtime.exec.evaluators.ShowEvaluator;
import org.elnamic.runtime.exec.evaluators.SwitchEvaluator;
import org.elnamic.runtime.exec.evaluators.TheoremEvaluator;
import org.elnamic.runtime.exec.evaluators.UnaryEvaluator;
import org.elnamic.runtime.exec.evaluators.VariableDeclarationEvaluator;
import org.elnamic.runtime.exec.evaluators.WhileEvaluator;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry mapping AST node classes to evaluator instances, similar in spirit to the
 * parser's {@code StatementHandlerRegistry}.
 * <p>
 * Provides explicit registration and a default evaluator fallback. The {@link #resolve(AstNode)} method
 * walks the class hierarchy to find the nearest registered evaluator.
 */
public final class EvaluatorRegistry {

    private final Map<Class<? extends AstNode>, INodeEvaluator<? extends AstNode>> byClass = new HashMap<>();
    private final INodeEvaluator<AstNode> defaultEvaluator;

    private EvaluatorRegistry(INodeEvaluator<AstNode> defaultEvaluator) {
        this.defaultEvaluator = defaultEvaluator;
    }

    /**
     * Registers an evaluator for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param evaluator The evaluator instance handling that class.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, INodeEvaluator<T> evaluator) {
        byClass.put(nodeType, evaluator);
    }

    /**
     * Resolves an evaluator for the given node by searching the node's concrete class,
     * then its interfaces and superclasses. Falls back to the default evaluator.
     *
     * @param node The AST node instance to resolve an evaluator for.
     * @return A non-null evaluator to handle the node.
     */
    @SuppressWarnings("unchecked")
    public INodeEvaluator<AstNode> resolve(AstNode node) {
        Class<?> c = node.getClass();
        while (c != null && AstNode.class.isAssignableFrom(c)) {
            INodeEvaluator<?> found = byClass.get(c);
            if (found != null) return (INodeEvaluator<AstNode>) found;
            for (Class<?> i : c.getInterfaces()) {
                if (AstNode.class.isAssignableFrom(i)) {
                    found = byClass.get(i.asSubclass(AstNode.class));
                    if (found != null) return (INodeEvaluator<AstNode>) found;
                }
            }
            c = c.getSuperclass();
        }
        return defaultEvaluator;
    }

    /**
     * Creates a registry instance with the given default evaluator and nothing registered.
     *
     * @param defaultEvaluator The fallback evaluator used for unknown node types.
     * @return A new registry instance.
     */
    public static EvaluatorRegistry initialize(INodeEvaluator<AstNode> defaultEvaluator) {
        return new EvaluatorRegistry(defaultEvaluator);
    }

    /**
     * Initializes a registry with the default evaluator and registers all built-in evaluators.
     *
     * @return A registry pre-populated with the standard evaluators.
     */
    public static EvaluatorRegistry initializeWithDefaults() {
        EvaluatorRegistry reg = initialize(new DefaultNodeEvaluator());
        // expressions
        reg.register(LiteralNode.class, new LiteralEvaluator());
        reg.register(IdentifierNode.class, new IdentifierEvaluator());
        reg.register(BinaryNode.class, new BinaryEvaluator());
        reg.register(UnaryNode.class, new UnaryEvaluator());
        reg.register(CallNode.class, new CallEvaluator());
        reg.register(IndexNode.class, new IndexEvaluator());
        reg.register(ArrayLiteralNode.class, new ArrayLiteralEvaluator());
        // statements
        reg.register(BlockNode.class, new BlockEvaluator());
        reg.register(ExpressionStatementNode.class, new ExpressionStatementEvaluator());
        reg.register(AssignmentNode.class, new AssignmentEvaluator());
        reg.register(IndexAssignmentNode.class, new IndexAssignmentEvaluator());
        reg.register(VariableDeclarationNode.class, new VariableDeclarationEvaluator());
        reg.register(IfNode.class, new IfEvaluator());
        reg.register(WhileNode.class, new WhileEvaluator());
        reg.register(DoWhileNode.class, new DoWhileEvaluator());
        reg.register(ForNode.class, new ForEvaluator());
        reg.register(ForEachNode.class, new ForEachEvaluator());
        reg.register(BreakNode.class, new BreakEvaluator());
        reg.register(SwitchNode.class, new SwitchEvaluator());
        reg.register(FunctionDeclarationNode.class, new FunctionDeclarationEvaluator());
        reg.register(ReturnNode.class, new ReturnEvaluator());
        reg.register(ShowNode.class, new ShowEvaluator());
        reg.register(TheoremNode.class, new TheoremEvaluator());
        reg.register(AxiomNode.class, new AxiomEvaluator());
        reg.register(ProofNode.class, new ProofEvaluator());
        return reg;
    }
}
