package com.neurosim.graph.fn.transfer;

import com.neurosim.graph.fn.AbstractTransferFunction;
import com.neurosim.graph.fn.Fn1;
import com.neurosim.graph.fn.ParameterValues;

import java.util.Map;
import java.util.Objects;

/**
 * Adapts a user-supplied {@link Fn1} lambda as a parameterless transfer function.
 *
 * <pre>{@code
 * TransferFunction square = new Elementwise("square", x -> x * x);
 * }</pre>
 */
public final class Elementwise extends AbstractTransferFunction {
    private final Fn1 fn;

    public Elementwise(String name, Fn1 fn) {
        super(name, Map.of());
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    @Override
    protected double applyElement(double x, ParameterValues params) {
        return fn.apply(x);
    }
}
