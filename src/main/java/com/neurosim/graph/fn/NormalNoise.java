package com.neurosim.graph.fn;

import java.util.Random;

/**
 * Gaussian noise with a fixed seed, so runs are reproducible.
 */
public final class NormalNoise implements NoiseSource {
    private final double mean;
    private final double standardDeviation;
    private final Random random;

    public NormalNoise(double mean, double standardDeviation, long seed) {
        if (!(standardDeviation >= 0))
            throw new IllegalArgumentException("Standard deviation must be >= 0, got " + standardDeviation);
        this.mean = mean;
        this.standardDeviation = standardDeviation;
        this.random = new Random(seed);
    }

    @Override
    public double sample() {
        if (standardDeviation == 0.0)
            return mean;
        return mean + standardDeviation * random.nextGaussian();
    }
}
