package com.neurosim.graph.fn;

import java.util.List;

/**
 * How modulatory signals change the base value of a parameter.
 */
public enum ModulationOperator {
    /** Base plus the sum of the signals. */
    ADD,
    /** Base times the product of the signals. */
    MULTIPLY,
    /** The last signal replaces the base. */
    OVERRIDE,
    /** Signals are ignored; the base passes through. */
    DISABLE;

    public double modulate(double base, List<Double> signals) {
        if (signals.isEmpty())
            return base;
        return switch (this) {
            case ADD -> {
                double v = base;
                for (double s : signals)
                    v += s;
                yield v;
            }
            case MULTIPLY -> {
                double v = base;
                for (double s : signals)
                    v *= s;
                yield v;
            }
            case OVERRIDE -> signals.get(signals.size() - 1);
            case DISABLE -> base;
        };
    }
}
