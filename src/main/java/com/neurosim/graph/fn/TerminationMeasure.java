package com.neurosim.graph.fn;

import java.util.Objects;

/**
 * Scalar status used to decide whether a stateful mechanism stops iterating.
 *
 * Two kinds exist:
 * - Boundary: a function of the new value alone (e.g. "largest element").
 * - Convergence: a function of the new value and the value before the update
 * (e.g. "largest absolute element-wise change").
 *
 * Both see the 2-D value flattened row by row.
 */
public final class TerminationMeasure {

    /** Number of arguments the measure consumes. */
    public enum Kind {
        BOUNDARY,
        CONVERGENCE
    }

    /** Two-argument measure over flattened current and previous values. */
    @FunctionalInterface
    public interface ConvergenceFn {
        double apply(double[] value, double[] previous);
    }

    private final String name;
    private final Kind kind;
    private final FnN boundary;
    private final ConvergenceFn convergence;

    private TerminationMeasure(String name, Kind kind, FnN boundary, ConvergenceFn convergence) {
        this.name = name;
        this.kind = kind;
        this.boundary = boundary;
        this.convergence = convergence;
    }

    public static TerminationMeasure boundary(String name, FnN fn) {
        return new TerminationMeasure(name, Kind.BOUNDARY, Objects.requireNonNull(fn, "fn"), null);
    }

    public static TerminationMeasure convergence(String name, ConvergenceFn fn) {
        return new TerminationMeasure(name, Kind.CONVERGENCE, null, Objects.requireNonNull(fn, "fn"));
    }

    public String name() {
        return name;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Computes the status.
     *
     * @param value    The value just produced.
     * @param previous The value before the update; ignored by boundary measures.
     */
    public double measure(double[][] value, double[][] previous) {
        double[] flatValue = flatten(value);
        if (kind == Kind.BOUNDARY)
            return boundary.apply(flatValue);
        double[] flatPrevious = flatten(previous);
        if (flatPrevious.length != flatValue.length)
            throw new IllegalStateException("Measure " + name + " got value of length " + flatValue.length
                    + " but previous value of length " + flatPrevious.length);
        return convergence.apply(flatValue, flatPrevious);
    }

    private static double[] flatten(double[][] rows) {
        int n = 0;
        for (double[] row : rows)
            n += row.length;
        double[] flat = new double[n];
        int k = 0;
        for (double[] row : rows) {
            System.arraycopy(row, 0, flat, k, row.length);
            k += row.length;
        }
        return flat;
    }

    @Override
    public String toString() {
        return name + "(" + kind + ")";
    }
}
