package org.elnamic.runtime;

import com.typesafe.config.Config;

/**
 * Execution limits of an interpreter.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * elnamic.runtime {
 *   max-loop-iterations = 10000000  # per loop execution; 0 disables the limit
 *   max-call-depth = 500            # nested function calls
 * }
 * </pre>
 *
 * @param maxLoopIterations The number of iterations a single loop may run; 0 means unlimited.
 * @param maxCallDepth The maximum nesting of function calls.
 */
public record RuntimeOptions(long maxLoopIterations, int maxCallDepth) {

    private static final String RUNTIME_CONFIG_PATH = "elnamic.runtime";

    public static RuntimeOptions defaults() {
        return new RuntimeOptions(10_000_000L, 500);
    }

    /**
     * Reads the limits from the {@code elnamic.runtime} block, falling back to the defaults
     * for missing keys.
     * @param config The application configuration.
     * @return The options.
     */
    public static RuntimeOptions fromConfig(Config config) {
        RuntimeOptions defaults = defaults();
        if (!config.hasPath(RUNTIME_CONFIG_PATH)) {
            return defaults;
        }
        Config runtime = config.getConfig(RUNTIME_CONFIG_PATH);
        long iterations = runtime.hasPath("max-loop-iterations")
                ? runtime.getLong("max-loop-iterations") : defaults.maxLoopIterations();
        int depth = runtime.hasPath("max-call-depth")
                ? runtime.getInt("max-call-depth") : defaults.maxCallDepth();
        return new RuntimeOptions(iterations, depth);
    }
}
