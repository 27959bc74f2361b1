package com.neurosim.graph.fn;

/**
 * Standard integrator update rules.
 */
public final class Integrators {
    private Integrators() {
        // Utility class
    }

    /**
     * Exponentially weighted update.
     * Logic: rate * input + (1 - rate) * previous + noise
     */
    public static final IntegratorFunction ADAPTIVE = (in, prev, rate, noise) -> rate * in + (1.0 - rate) * prev
            + noise;

    /**
     * Running sum of scaled input.
     * Logic: previous + rate * input + noise
     */
    public static final IntegratorFunction SIMPLE = (in, prev, rate, noise) -> prev + rate * in + noise;

    /**
     * Decays or grows the previous value, ignoring input.
     * Logic: rate * previous + noise
     */
    public static final IntegratorFunction ACCUMULATOR = (in, prev, rate, noise) -> rate * prev + noise;
}
