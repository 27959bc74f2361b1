package com.neurosim.graph.node;

import com.neurosim.graph.api.PortId;
import com.neurosim.graph.fn.CombinationRule;

import java.util.Objects;

/**
 * Typed specification of an input port, resolved once by
 * {@link Mechanism.Builder#inputPort(String, PortSpec...)}.
 *
 * A port is described by a list of specs: exactly one {@link Value} that
 * fixes its shape, any number of {@link ProjectionRef}/{@link PortRef}
 * afferents and at most one {@link Combinator}.
 *
 * <pre>{@code
 * Mechanism.builder("B")
 *         .inputPort("in", PortSpec.value(0, 0), PortSpec.from(a.output(0)), PortSpec.combine(CombinationRule.MEAN))
 *         .build();
 * }</pre>
 */
public interface PortSpec {

    /** Default variable of the port. */
    record Value(double[] defaultVariable) implements PortSpec {
        public Value {
            Objects.requireNonNull(defaultVariable, "defaultVariable");
            defaultVariable = defaultVariable.clone();
        }
    }

    /** Afferent projection from an existing output port through a matrix. */
    record ProjectionRef(PortId sender, Matrix matrix, boolean feedback) implements PortSpec {
        public ProjectionRef {
            Objects.requireNonNull(sender, "sender");
            Objects.requireNonNull(matrix, "matrix");
        }
    }

    /** Identity afferent from an existing output port. */
    record PortRef(PortId sender) implements PortSpec {
        public PortRef {
            Objects.requireNonNull(sender, "sender");
        }
    }

    /** Combination rule for several afferents. */
    record Combinator(CombinationRule rule) implements PortSpec {
        public Combinator {
            Objects.requireNonNull(rule, "rule");
        }
    }

    static PortSpec value(double... defaultVariable) {
        return new Value(defaultVariable);
    }

    static PortSpec size(int n) {
        return new Value(new double[n]);
    }

    static PortSpec from(PortId sender) {
        return new PortRef(sender);
    }

    static PortSpec from(PortId sender, Matrix matrix) {
        return new ProjectionRef(sender, matrix, false);
    }

    static PortSpec feedbackFrom(PortId sender, Matrix matrix) {
        return new ProjectionRef(sender, matrix, true);
    }

    static PortSpec combine(CombinationRule rule) {
        return new Combinator(rule);
    }
}
