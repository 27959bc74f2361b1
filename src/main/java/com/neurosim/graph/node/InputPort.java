package com.neurosim.graph.node;

import com.neurosim.graph.fn.CombinationRule;

import java.util.List;

/**
 * Input port of a mechanism, resolved from its {@link PortSpec}s.
 *
 * @param name            port name, unique within the mechanism
 * @param defaultVariable variable used when nothing arrives; also fixes the
 *                        port's length
 * @param combination     how several afferent vectors are combined
 * @param afferents       projections declared on the mechanism, created when
 *                        it is added to a composition
 */
public record InputPort(String name, double[] defaultVariable, CombinationRule combination,
        List<PortSpec.ProjectionRef> afferents) {

    public int size() {
        return defaultVariable.length;
    }
}
