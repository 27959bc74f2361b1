package com.neurosim.graph.fn;

/**
 * Standard termination measures.
 */
public final class TerminationMeasures {
    private TerminationMeasures() {
        // Utility class
    }

    /** Largest absolute element-wise difference between value and previous value. */
    public static final TerminationMeasure MAX_ABS_DIFF = TerminationMeasure.convergence("MAX_ABS_DIFF",
            (v, p) -> {
                double max = 0.0;
                for (int i = 0; i < v.length; i++)
                    max = Math.max(max, Math.abs(v[i] - p[i]));
                return max;
            });

    /** Sum of absolute element-wise differences. */
    public static final TerminationMeasure SUM_ABS_DIFF = TerminationMeasure.convergence("SUM_ABS_DIFF",
            (v, p) -> {
                double sum = 0.0;
                for (int i = 0; i < v.length; i++)
                    sum += Math.abs(v[i] - p[i]);
                return sum;
            });

    /** Euclidean distance between value and previous value. */
    public static final TerminationMeasure EUCLIDEAN = TerminationMeasure.convergence("EUCLIDEAN",
            (v, p) -> {
                double sum = 0.0;
                for (int i = 0; i < v.length; i++) {
                    double d = v[i] - p[i];
                    sum += d * d;
                }
                return Math.sqrt(sum);
            });

    /** Energy of the value against the previous value: {@code -1/2 * sum(v[i] * p[i])}. */
    public static final TerminationMeasure ENERGY = TerminationMeasure.convergence("ENERGY",
            (v, p) -> {
                double sum = 0.0;
                for (int i = 0; i < v.length; i++)
                    sum += v[i] * p[i];
                return -0.5 * sum;
            });

    /** Cross entropy {@code -sum(v[i] * ln p[i])}; elements with v[i] == 0 add nothing. */
    public static final TerminationMeasure ENTROPY = TerminationMeasure.convergence("ENTROPY",
            (v, p) -> {
                double sum = 0.0;
                for (int i = 0; i < v.length; i++) {
                    if (v[i] != 0.0)
                        sum += v[i] * Math.log(p[i]);
                }
                return -sum;
            });

    /** Largest element of the value. */
    public static final TerminationMeasure MAX = TerminationMeasure.boundary("MAX", v -> {
        double max = Double.NEGATIVE_INFINITY;
        for (double x : v)
            max = Math.max(max, x);
        return max;
    });

    /** Smallest element of the value. */
    public static final TerminationMeasure MIN = TerminationMeasure.boundary("MIN", v -> {
        double min = Double.POSITIVE_INFINITY;
        for (double x : v)
            min = Math.min(min, x);
        return min;
    });
}
