package com.neurosim.graph.fn;

/**
 * Functional interface for a reduction of N values to one scalar.
 *
 * Used for boundary termination measures, which see the mechanism's whole
 * value flattened into one array. The array is a scratch buffer owned by the
 * caller; implementations must not keep a reference to it.
 */
@FunctionalInterface
public interface FnN {
    /**
     * Reduces the inputs.
     *
     * @param inputs The values (read-only, transient).
     * @return The result.
     */
    double apply(double[] inputs);
}
