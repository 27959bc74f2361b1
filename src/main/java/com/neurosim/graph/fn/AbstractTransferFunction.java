package com.neurosim.graph.fn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for transfer functions that map each element independently.
 *
 * Subclasses declare their parameters once and implement
 * {@link #applyElement(double, ParameterValues)}; this class runs the row
 * loop.
 */
public abstract class AbstractTransferFunction implements TransferFunction {
    private final String name;
    private final Map<String, Double> defaults;

    protected AbstractTransferFunction(String name, Map<String, Double> defaults) {
        this.name = name;
        this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Map<String, Double> defaultParameters() {
        return defaults;
    }

    @Override
    public void apply(double[] input, double[] output, ParameterValues params) {
        for (int i = 0; i < input.length; i++)
            output[i] = applyElement(input[i], params);
    }

    protected abstract double applyElement(double x, ParameterValues params);

    @Override
    public String toString() {
        return name + defaults;
    }
}
