package com.neurosim.graph.fn;

/**
 * Maps the slice of a mechanism's value read by an output port to the
 * port's value.
 */
@FunctionalInterface
public interface OutputFunction {

    double[] apply(double[] input);

    /**
     * Length of the produced vector for an input of the given length. Needed
     * to check projection matrices before anything runs.
     */
    default int outputLength(int inputLength) {
        return inputLength;
    }
}
