package com.neurosim.graph.node;

import com.neurosim.graph.fn.OutputFunction;

/**
 * Output port of a mechanism: reads a slice of the value and maps it
 * through an output function.
 */
public record OutputPort(String name, VariableSpec variable, OutputFunction function) {

    public double[] compute(double[][] value) {
        return function.apply(variable.read(value));
    }

    public int size(int[] valueRowLengths) {
        return function.outputLength(variable.length(valueRowLengths));
    }
}
