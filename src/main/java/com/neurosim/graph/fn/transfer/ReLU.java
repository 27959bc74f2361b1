package com.neurosim.graph.fn.transfer;

import com.neurosim.graph.fn.AbstractTransferFunction;
import com.neurosim.graph.fn.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Leaky rectifier on gain * (x - bias). Negative inputs are scaled by leak.
 */
public final class ReLU extends AbstractTransferFunction {
    public static final String GAIN = "gain";
    public static final String BIAS = "bias";
    public static final String LEAK = "leak";

    public ReLU() {
        this(1.0, 0.0, 0.0);
    }

    public ReLU(double gain, double bias, double leak) {
        super("ReLU", params(gain, bias, leak));
    }

    private static Map<String, Double> params(double gain, double bias, double leak) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(GAIN, gain);
        m.put(BIAS, bias);
        m.put(LEAK, leak);
        return m;
    }

    @Override
    protected double applyElement(double x, ParameterValues p) {
        double v = p.get(GAIN) * (x - p.get(BIAS));
        return v > 0 ? v : p.get(LEAK) * v;
    }
}
