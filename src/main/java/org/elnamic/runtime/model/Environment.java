package org.elnamic.runtime.model;

import org.elnamic.api.ConstantAssignmentException;
import org.elnamic.api.RedeclarationException;
import org.elnamic.api.SourceInfo;
import org.elnamic.api.TypeMismatchException;
import org.elnamic.api.UnboundNameException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One scope of the scope chain: a mapping from names to bindings with a link to the
 * enclosing scope. Lookups and assignments walk outward on a miss; declarations only ever
 * touch this scope.
 */
public final class Environment {

    private final Environment parent;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    /**
     * Creates a scope.
     * @param parent The enclosing scope, or {@code null} for the global scope.
     */
    public Environment(Environment parent) {
        this.parent = parent;
    }

    /**
     * @return A new global scope without parent.
     */
    public static Environment global() {
        return new Environment(null);
    }

    /**
     * Declares a mutable, untyped name in this scope.
     *
     * @param name The name to declare.
     * @param value The initial value.
     * @param at The declaring position, for errors.
     * @throws RedeclarationException if this scope already binds the name.
     */
    public void define(String name, Value value, SourceInfo at) {
        define(name, value, null, false, at);
    }

    /**
     * Declares a name in this scope.
     *
     * @param name The name to declare.
     * @param value The initial value; {@link UnitValue} for a declaration without initializer.
     * @param type The declared type, or {@code null} for an untyped binding.
     * @param constant Whether later assignments are rejected.
     * @param at The declaring position, for errors.
     * @throws RedeclarationException if this scope already binds the name.
     * @throws TypeMismatchException if the value does not conform to the declared type.
     */
    public void define(String name, Value value, TypeName type, boolean constant, SourceInfo at) {
        if (bindings.containsKey(name)) {
            throw new RedeclarationException("Name '" + name + "' is already declared in this scope", at);
        }
        bindings.put(name, new Binding(conform(name, value, type, at), type, constant));
    }

    /**
     * Resolves a name through the scope chain.
     *
     * @param name The name to resolve.
     * @param at The referencing position, for errors.
     * @return The bound value.
     * @throws UnboundNameException if no scope binds the name.
     */
    public Value get(String name, SourceInfo at) {
        return lookup(name).orElseThrow(() -> new UnboundNameException(name, at));
    }

    /**
     * Resolves a name through the scope chain without failing.
     * @param name The name to resolve.
     * @return The bound value, or empty if unbound.
     */
    public Optional<Value> lookup(String name) {
        Binding binding = find(name);
        return binding != null ? Optional.of(binding.value) : Optional.empty();
    }

    /**
     * Rebinds the innermost binding of a name.
     *
     * @param name The assigned name.
     * @param value The new value.
     * @param at The assigning position, for errors.
     * @throws UnboundNameException if no scope binds the name.
     * @throws ConstantAssignmentException if the binding is a constant.
     * @throws TypeMismatchException if the value does not conform to the binding's declared type.
     */
    public void assign(String name, Value value, SourceInfo at) {
        Binding binding = find(name);
        if (binding == null) {
            throw new UnboundNameException(name, at);
        }
        if (binding.constant) {
            throw new ConstantAssignmentException("Cannot assign to constant '" + name + "'", at);
        }
        binding.value = conform(name, value, binding.type, at);
    }

    /**
     * @param name The name to check.
     * @return Whether this scope itself (not its parents) binds the name.
     */
    public boolean isDeclaredLocally(String name) {
        return bindings.containsKey(name);
    }

    private Binding find(String name) {
        for (Environment scope = this; scope != null; scope = scope.parent) {
            Binding binding = scope.bindings.get(name);
            if (binding != null) {
                return binding;
            }
        }
        return null;
    }

    private static Value conform(String name, Value value, TypeName type, SourceInfo at) {
        if (type == null || value == UnitValue.INSTANCE) {
            return value;
        }
        if (!type.accepts(value)) {
            throw new TypeMismatchException(String.format("'%s' is declared %s but was given a %s value",
                    name, type.displayName(), value.kindName()), at);
        }
        return type.coerce(value);
    }

    private static final class Binding {
        private Value value;
        private final TypeName type;
        private final boolean constant;

        private Binding(Value value, TypeName type, boolean constant) {
            this.value = value;
            this.type = type;
            this.constant = constant;
        }
    }
}
