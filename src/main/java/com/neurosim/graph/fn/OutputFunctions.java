package com.neurosim.graph.fn;

/**
 * Standard output-port functions. All but {@link #IDENTITY} reduce their
 * input to a single element.
 */
public final class OutputFunctions {
    private OutputFunctions() {
        // Utility class
    }

    public static final OutputFunction IDENTITY = double[]::clone;

    public static final OutputFunction MEAN = reducer(OutputFunctions::mean);

    public static final OutputFunction VARIANCE = reducer(OutputFunctions::variance);

    public static final OutputFunction STANDARD_DEVIATION = reducer(v -> Math.sqrt(variance(v)));

    public static final OutputFunction MAX_VAL = reducer(v -> {
        double max = Double.NEGATIVE_INFINITY;
        for (double x : v)
            max = Math.max(max, x);
        return max;
    });

    /** Element with the largest magnitude, sign preserved. */
    public static final OutputFunction MAX_ABS_VAL = reducer(v -> {
        double best = 0.0;
        for (double x : v)
            if (Math.abs(x) > Math.abs(best))
                best = x;
        return best;
    });

    /** Wraps a reduction as an output function producing a one-element vector. */
    public static OutputFunction reducer(FnN fn) {
        return new OutputFunction() {
            @Override
            public double[] apply(double[] input) {
                return new double[] { fn.apply(input) };
            }

            @Override
            public int outputLength(int inputLength) {
                return 1;
            }
        };
    }

    private static double mean(double[] v) {
        if (v.length == 0)
            return Double.NaN;
        double sum = 0.0;
        for (double x : v)
            sum += x;
        return sum / v.length;
    }

    // Population variance.
    private static double variance(double[] v) {
        double m = mean(v);
        double sum = 0.0;
        for (double x : v)
            sum += (x - m) * (x - m);
        return v.length == 0 ? Double.NaN : sum / v.length;
    }
}
