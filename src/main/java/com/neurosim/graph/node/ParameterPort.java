package com.neurosim.graph.node;

/**
 * One modulable scalar parameter of a mechanism or its function.
 *
 * When several modulatory projections target the same port, their signals
 * are grouped by operator and applied to the base value in the order ADD,
 * MULTIPLY, OVERRIDE, so an override always wins.
 */
public record ParameterPort(String name, double baseValue) {
}
