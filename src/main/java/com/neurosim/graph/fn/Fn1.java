package com.neurosim.graph.fn;

/**
 * Functional interface for an element-wise scalar transform.
 *
 * <p>
 * Used by {@link com.neurosim.graph.fn.transfer.Elementwise} to turn a lambda
 * into a mechanism function that is applied to every element of every row.
 *
 * <p>
 * Examples:
 * <ul>
 * <li>{@code x -> x * 2.0}</li>
 * <li>{@code Math::tanh}</li>
 * </ul>
 */
@FunctionalInterface
public interface Fn1 {
    /**
     * Applies the function.
     *
     * @param a The input element.
     * @return The transformed element.
     */
    double apply(double a);
}
