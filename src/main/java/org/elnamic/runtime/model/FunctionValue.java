package org.elnamic.runtime.model;

import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationNode;
import org.elnamic.compiler.frontend.parser.features.function.ParameterNode;

import java.util.List;

/**
 * A closure: a function declaration paired with the scope it was declared in.
 * Calls run in a child of {@link #closure()}, never of the caller's scope.
 * Two function values are equal only if they are the same value.
 */
public final class FunctionValue implements Value {

    private final FunctionDeclarationNode declaration;
    private final Environment closure;

    public FunctionValue(FunctionDeclarationNode declaration, Environment closure) {
        this.declaration = declaration;
        this.closure = closure;
    }

    public String name() {
        return declaration.name().text();
    }

    public List<ParameterNode> parameters() {
        return declaration.parameters();
    }

    public int arity() {
        return declaration.parameters().size();
    }

    public FunctionDeclarationNode declaration() {
        return declaration;
    }

    public Environment closure() {
        return closure;
    }

    @Override
    public String kindName() {
        return "function";
    }

    @Override
    public String toDisplayString() {
        return "<function " + name() + ">";
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
