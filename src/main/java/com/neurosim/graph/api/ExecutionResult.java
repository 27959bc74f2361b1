package com.neurosim.graph.api;

/**
 * Outcome of one firing of a mechanism.
 *
 * A stateful mechanism may iterate several times inside one firing; hitting
 * the iteration ceiling is reported here through {@code converged == false}
 * instead of an exception.
 *
 * @param value          the mechanism's final value, one row per value item
 * @param outputValues   the value of each output port, in port order
 * @param iterationsUsed number of update cycles run during this firing
 * @param converged      true if the termination check passed (always true
 *                       for stateless mechanisms)
 */
public record ExecutionResult(double[][] value, double[][] outputValues, int iterationsUsed, boolean converged) {
}
