package com.neurosim.graph.fn;

import java.util.Map;

/**
 * The primary transform of a mechanism.
 *
 * A transfer function is applied to each row of the mechanism's variable and
 * writes a row of the same length. Every entry of
 * {@link #defaultParameters()} becomes a parameter port on the owning
 * mechanism, so it can be overridden at runtime or modulated by another node.
 */
public interface TransferFunction {

    /** Short name used in logs and diagnostics. */
    String name();

    /**
     * Modulable scalar parameters and their default values, in declaration
     * order.
     */
    Map<String, Double> defaultParameters();

    /**
     * Transforms one row.
     *
     * @param input  The row to transform (read-only).
     * @param output Pre-allocated row of the same length to write into.
     * @param params Effective parameter values for this execution.
     */
    void apply(double[] input, double[] output, ParameterValues params);
}
