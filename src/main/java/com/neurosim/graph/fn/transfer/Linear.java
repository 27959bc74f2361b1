package com.neurosim.graph.fn.transfer;

import com.neurosim.graph.fn.AbstractTransferFunction;
import com.neurosim.graph.fn.ParameterValues;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * slope * x + intercept. With the defaults (1, 0) this is the identity.
 */
public final class Linear extends AbstractTransferFunction {
    public static final String SLOPE = "slope";
    public static final String INTERCEPT = "intercept";

    public Linear() {
        this(1.0, 0.0);
    }

    public Linear(double slope, double intercept) {
        super("Linear", params(slope, intercept));
    }

    private static Map<String, Double> params(double slope, double intercept) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(SLOPE, slope);
        m.put(INTERCEPT, intercept);
        return m;
    }

    @Override
    protected double applyElement(double x, ParameterValues p) {
        return p.get(SLOPE) * x + p.get(INTERCEPT);
    }
}
