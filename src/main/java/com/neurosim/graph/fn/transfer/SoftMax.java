package com.neurosim.graph.fn.transfer;

import com.neurosim.graph.fn.ParameterValues;
import com.neurosim.graph.fn.TransferFunction;

import java.util.Map;

/**
 * Row-wise softmax of gain * x. The row maximum is subtracted before
 * exponentiation to keep exp() finite.
 */
public final class SoftMax implements TransferFunction {
    public static final String GAIN = "gain";

    private final Map<String, Double> defaults;

    public SoftMax() {
        this(1.0);
    }

    public SoftMax(double gain) {
        this.defaults = Map.of(GAIN, gain);
    }

    @Override
    public String name() {
        return "SoftMax";
    }

    @Override
    public Map<String, Double> defaultParameters() {
        return defaults;
    }

    @Override
    public void apply(double[] input, double[] output, ParameterValues params) {
        if (input.length == 0)
            return;
        double gain = params.get(GAIN);
        double max = Double.NEGATIVE_INFINITY;
        for (double x : input)
            max = Math.max(max, gain * x);
        double sum = 0.0;
        for (int i = 0; i < input.length; i++) {
            output[i] = Math.exp(gain * input[i] - max);
            sum += output[i];
        }
        for (int i = 0; i < output.length; i++)
            output[i] /= sum;
    }

    @Override
    public String toString() {
        return name() + defaults;
    }
}
