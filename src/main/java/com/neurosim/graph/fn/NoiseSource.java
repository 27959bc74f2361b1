package com.neurosim.graph.fn;

/**
 * Supplies one noise sample per element per update.
 */
@FunctionalInterface
public interface NoiseSource {
    double sample();
}
