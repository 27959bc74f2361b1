package com.neurosim.graph.fn;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Effective parameter values for one execution of a mechanism: base values,
 * runtime overrides and modulation already applied.
 */
public final class ParameterValues {
    private static final ParameterValues EMPTY = new ParameterValues(Map.of());

    private final Map<String, Double> values;

    private ParameterValues(Map<String, Double> values) {
        this.values = values;
    }

    public static ParameterValues of(Map<String, Double> values) {
        return new ParameterValues(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ParameterValues empty() {
        return EMPTY;
    }

    /**
     * Returns the value of a parameter.
     *
     * @throws IllegalArgumentException if the parameter is unknown.
     */
    public double get(String name) {
        Double v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("Unknown parameter: " + name);
        return v;
    }

    public double getOrDefault(String name, double fallback) {
        Double v = values.get(name);
        return v == null ? fallback : v;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Map<String, Double> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
