package com.neurosim.graph.fn.transfer;

import com.neurosim.graph.fn.AbstractTransferFunction;
import com.neurosim.graph.fn.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * scale * exp(rate * x)
 */
public final class Exponential extends AbstractTransferFunction {
    public static final String RATE = "rate";
    public static final String SCALE = "scale";

    public Exponential() {
        this(1.0, 1.0);
    }

    public Exponential(double rate, double scale) {
        super("Exponential", params(rate, scale));
    }

    private static Map<String, Double> params(double rate, double scale) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(RATE, rate);
        m.put(SCALE, scale);
        return m;
    }

    @Override
    protected double applyElement(double x, ParameterValues p) {
        return p.get(SCALE) * Math.exp(p.get(RATE) * x);
    }
}
