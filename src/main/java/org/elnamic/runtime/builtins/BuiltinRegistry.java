package org.elnamic.runtime.builtins;

import org.elnamic.api.ArityException;
import org.elnamic.api.SourceInfo;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.model.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Name-based registry of builtin functions. Consulted only after the scope chain, so a
 * program may shadow any builtin with its own binding.
 */
public final class BuiltinRegistry {

    private final Map<String, Builtin> builtins = new TreeMap<>();

    /**
     * Registers a builtin, replacing an earlier one of the same name.
     *
     * @param name The call name.
     * @param minArity The fewest arguments accepted.
     * @param maxArity The most arguments accepted.
     * @param body The implementation.
     */
    public void register(String name, int minArity, int maxArity, IBuiltinFunction body) {
        builtins.put(name, new Builtin(name, minArity, maxArity, body));
    }

    /**
     * Registers a builtin taking exactly {@code arity} arguments.
     */
    public void register(String name, int arity, IBuiltinFunction body) {
        register(name, arity, arity, body);
    }

    public Optional<Builtin> find(String name) {
        return Optional.ofNullable(builtins.get(name));
    }

    /**
     * Checks the argument count and runs the builtin.
     *
     * @throws ArityException if the count is outside the accepted range.
     */
    public Value invoke(Builtin builtin, List<Value> args, ExecutionContext ctx, SourceInfo callSite) {
        if (!builtin.accepts(args.size())) {
            int expected = args.size() < builtin.minArity() ? builtin.minArity() : builtin.maxArity();
            throw new ArityException(builtin.name(), expected, args.size(), callSite);
        }
        return builtin.body().call(args, ctx, callSite);
    }

    /**
     * @return A registry holding the core, file and turtle builtins.
     */
    public static BuiltinRegistry initializeWithDefaults() {
        BuiltinRegistry registry = new BuiltinRegistry();
        CoreBuiltins.registerAll(registry);
        FileBuiltins.registerAll(registry);
        GraphicsBuiltins.registerAll(registry);
        return registry;
    }
}
