package com.neurosim.graph.fn;

/**
 * Element-wise update rule used by a mechanism in integrator mode.
 *
 * The mechanism keeps the integrator's previous output per execution context
 * and feeds it back on every update.
 */
@FunctionalInterface
public interface IntegratorFunction {

    /**
     * Computes the next integrator state for one element.
     *
     * @param input    The current input element.
     * @param previous The integrator's previous output for this element.
     * @param rate     The effective integration rate.
     * @param noise    Noise to add for this element.
     * @return The new integrator output.
     */
    double integrate(double input, double previous, double rate, double noise);
}
