package com.neurosim.graph.fn.transfer;

import com.neurosim.graph.fn.AbstractTransferFunction;
import com.neurosim.graph.fn.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Logistic sigmoid.
 * Logic: 1 / (1 + exp(-gain * (x - bias) + offset))
 */
public final class Logistic extends AbstractTransferFunction {
    public static final String GAIN = "gain";
    public static final String BIAS = "bias";
    public static final String OFFSET = "offset";

    public Logistic() {
        this(1.0, 0.0, 0.0);
    }

    public Logistic(double gain, double bias, double offset) {
        super("Logistic", params(gain, bias, offset));
    }

    private static Map<String, Double> params(double gain, double bias, double offset) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(GAIN, gain);
        m.put(BIAS, bias);
        m.put(OFFSET, offset);
        return m;
    }

    @Override
    protected double applyElement(double x, ParameterValues p) {
        return 1.0 / (1.0 + Math.exp(-p.get(GAIN) * (x - p.get(BIAS)) + p.get(OFFSET)));
    }
}
