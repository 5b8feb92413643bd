package org.elnamic;

import org.elnamic.api.ExecutionResult;
import org.elnamic.compiler.FrontendPipeline;
import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.runtime.Interpreter;
import org.elnamic.runtime.model.Value;

import java.util.Optional;

/**
 * An interactive session: inputs run one after another against one global scope. A failing
 * input leaves the bindings made by earlier inputs intact.
 */
public class ScriptSession {

    private final FrontendPipeline frontend;
    private final Interpreter interpreter;
    private int inputCount;

    ScriptSession(FrontendPipeline frontend, Interpreter interpreter) {
        this.frontend = frontend;
        this.interpreter = interpreter;
    }

    /**
     * Runs one input.
     *
     * @param input Source text of one or more statements.
     * @return The value of the input if it ends with a bare expression, for echoing.
     * @throws org.elnamic.api.ElException on any error in this input.
     */
    public Optional<Value> evaluate(String input) {
        inputCount++;
        ProgramNode program = frontend.read(input, "<repl:" + inputCount + ">");
        Value value = interpreter.execute(program);
        boolean endsWithExpression = !program.statements().isEmpty()
                && program.statements().get(program.statements().size() - 1) instanceof ExpressionStatementNode;
        return endsWithExpression ? Optional.of(value) : Optional.empty();
    }

    /**
     * @return The proof bookkeeping accumulated so far.
     */
    public ExecutionResult status() {
        return ElEngine.summarize("repl", interpreter.theorems());
    }
}
