package org.elnamic.runtime;

import org.elnamic.api.EvaluationException;
import org.elnamic.api.ExecutionLimitException;
import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.runtime.builtins.BuiltinRegistry;
import org.elnamic.runtime.exec.BreakSignal;
import org.elnamic.runtime.exec.EvaluatorRegistry;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.exec.ReturnSignal;
import org.elnamic.runtime.model.Environment;
import org.elnamic.runtime.model.Value;
import org.elnamic.runtime.proof.TheoremRegistry;

import java.util.List;

/**
 * Tree-walking interpreter owning one global scope and one theorem registry. Successive calls
 * to {@link #executeStatements(List)} share that state, which is what the REPL relies on.
 * Not thread-safe.
 */
public class Interpreter {

    private final Environment globals = Environment.global();
    private final TheoremRegistry theorems = new TheoremRegistry();
    private final ExecutionContext context;

    public Interpreter(RuntimeServices services, RuntimeOptions options) {
        this(EvaluatorRegistry.initializeWithDefaults(), BuiltinRegistry.initializeWithDefaults(), services, options);
    }

    public Interpreter(EvaluatorRegistry evaluators, BuiltinRegistry builtins, RuntimeServices services,
                       RuntimeOptions options) {
        this.context = new ExecutionContext(evaluators, builtins, theorems, services, options, globals);
    }

    /**
     * Runs a whole program in the global scope.
     * @param program The analyzed program.
     * @return The value of the last top-level statement.
     */
    public Value execute(ProgramNode program) {
        return executeStatements(program.statements());
    }

    /**
     * Runs statements in the global scope.
     *
     * @param statements Top-level statements.
     * @return The value of the last statement.
     * @throws org.elnamic.api.ElException on the first runtime error.
     */
    public Value executeStatements(List<AstNode> statements) {
        try {
            return context.executeIn(globals, statements);
        } catch (BreakSignal signal) {
            throw new EvaluationException("'break' outside of a loop or switch", lastPosition(statements));
        } catch (ReturnSignal signal) {
            throw new EvaluationException("'return' outside of a function", lastPosition(statements));
        } catch (StackOverflowError e) {
            throw new ExecutionLimitException("Recursion too deep for the interpreter stack; lower "
                    + "elnamic.runtime.max-call-depth", lastPosition(statements));
        }
    }

    public Environment globals() {
        return globals;
    }

    public TheoremRegistry theorems() {
        return theorems;
    }

    private static SourceInfo lastPosition(List<AstNode> statements) {
        return statements.isEmpty() ? SourceInfo.UNKNOWN
                : statements.get(statements.size() - 1).sourceInfo();
    }
}
