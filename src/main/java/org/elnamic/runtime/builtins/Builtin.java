package org.elnamic.runtime.builtins;

/**
 * A named builtin with the accepted argument count range.
 *
 * @param name The name programs call it by.
 * @param minArity The fewest arguments accepted.
 * @param maxArity The most arguments accepted.
 * @param body The implementation.
 */
public record Builtin(String name, int minArity, int maxArity, IBuiltinFunction body) {

    public boolean accepts(int argumentCount) {
        return argumentCount >= minArity && argumentCount <= maxArity;
    }
}
