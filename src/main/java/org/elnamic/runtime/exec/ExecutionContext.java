package org.elnamic.runtime.exec;

import org.elnamic.api.ArityException;
import org.elnamic.api.ExecutionLimitException;
import org.elnamic.api.SourceInfo;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.compiler.frontend.parser.features.function.ParameterNode;
import org.elnamic.runtime.RuntimeOptions;
import org.elnamic.runtime.RuntimeServices;
import org.elnamic.runtime.builtins.BuiltinRegistry;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.Environment;
import org.elnamic.runtime.model.FunctionValue;
import org.elnamic.runtime.model.UnitValue;
import org.elnamic.runtime.model.Value;
import org.elnamic.runtime.proof.TheoremRegistry;

import java.util.List;
import java.util.function.Supplier;

/**
 * Mutable state of one running interpreter: the current scope, the call depth and the
 * registries and collaborators evaluators need. Evaluators reach everything through it.
 * Not thread-safe; one program runs at a time.
 */
public final class ExecutionContext {

    private final EvaluatorRegistry evaluators;
    private final BuiltinRegistry builtins;
    private final TheoremRegistry theorems;
    private final RuntimeServices services;
    private final RuntimeOptions options;
    private Environment environment;
    private int callDepth;

    public ExecutionContext(EvaluatorRegistry evaluators, BuiltinRegistry builtins, TheoremRegistry theorems,
                            RuntimeServices services, RuntimeOptions options, Environment globals) {
        this.evaluators = evaluators;
        this.builtins = builtins;
        this.theorems = theorems;
        this.services = services;
        this.options = options;
        this.environment = globals;
    }

    /**
     * Evaluates a node in the current scope.
     * @param node The node.
     * @return Its value.
     */
    public Value evaluate(AstNode node) {
        return evaluators.resolve(node).evaluate(node, this);
    }

    /**
     * Runs statements in the given scope and restores the previous scope afterwards, also
     * when a signal or error unwinds through.
     *
     * @param statements The statements to run in order.
     * @param scope The scope to run them in.
     * @return The value of the last statement, or unit for an empty list.
     */
    public Value executeIn(Environment scope, List<AstNode> statements) {
        return inScope(scope, () -> {
            Value last = UnitValue.INSTANCE;
            for (AstNode statement : statements) {
                last = evaluate(statement);
            }
            return last;
        });
    }

    /**
     * Runs an action with {@code scope} as the current scope and restores the previous one.
     *
     * @param scope The scope to make current.
     * @param action The action.
     * @param <T> The result type.
     * @return The action's result.
     */
    public <T> T inScope(Environment scope, Supplier<T> action) {
        Environment previous = environment;
        environment = scope;
        try {
            return action.get();
        } finally {
            environment = previous;
        }
    }

    /**
     * Creates a child of the current scope.
     * @return The new scope.
     */
    public Environment newChildScope() {
        return new Environment(environment);
    }

    /**
     * Evaluates an expression that must produce a truth value.
     *
     * @param expression The expression.
     * @param role What the value is used as, for the error message (e.g. "if condition").
     * @return The truth value.
     * @throws TypeMismatchException if the value is not a {@link Boolean3}.
     */
    public Boolean3 evaluateTruth(ExpressionNode expression, String role) {
        Value value = evaluate(expression);
        if (value instanceof Boolean3 truth) {
            return truth;
        }
        throw new TypeMismatchException(role + " must be a boolean but was " + value.kindName(), expression.sourceInfo());
    }

    /**
     * Like {@link #evaluateTruth(ExpressionNode, String)}, but in the given scope.
     */
    public Boolean3 evaluateTruthIn(Environment scope, ExpressionNode expression, String role) {
        return inScope(scope, () -> evaluateTruth(expression, role));
    }

    /**
     * Calls a closure: binds the arguments in a child of the closure's scope and runs the body.
     *
     * @param function The callee.
     * @param arguments The evaluated arguments.
     * @param callSite The position of the call.
     * @return The returned value, or unit if the body finishes without {@code return}.
     */
    public Value callFunction(FunctionValue function, List<Value> arguments, SourceInfo callSite) {
        if (arguments.size() != function.arity()) {
            throw new ArityException(function.name(), function.arity(), arguments.size(), callSite);
        }
        if (callDepth >= options.maxCallDepth()) {
            throw new ExecutionLimitException("Call depth limit of " + options.maxCallDepth() + " exceeded in '"
                    + function.name() + "'", callSite);
        }

        Environment callScope = new Environment(function.closure());
        List<ParameterNode> parameters = function.parameters();
        for (int i = 0; i < parameters.size(); i++) {
            ParameterNode parameter = parameters.get(i);
            callScope.define(parameter.name().text(), arguments.get(i),
                    parameter.type() != null ? parameter.type().type() : null, false, parameter.name().sourceInfo());
        }

        callDepth++;
        try {
            executeIn(callScope, function.declaration().body().statements());
            return UnitValue.INSTANCE;
        } catch (ReturnSignal signal) {
            return signal.value();
        } finally {
            callDepth--;
        }
    }

    /**
     * Fails once a loop has run more iterations than allowed.
     * @param iterations The number of iterations started so far, including the current one.
     * @param loop The position of the loop.
     */
    public void countIteration(long iterations, SourceInfo loop) {
        long limit = options.maxLoopIterations();
        if (limit > 0 && iterations > limit) {
            throw new ExecutionLimitException("Loop exceeded " + limit + " iterations", loop);
        }
    }

    public Environment environment() {
        return environment;
    }

    public BuiltinRegistry builtins() {
        return builtins;
    }

    public TheoremRegistry theorems() {
        return theorems;
    }

    public RuntimeServices services() {
        return services;
    }

    public RuntimeOptions options() {
        return options;
    }
}
