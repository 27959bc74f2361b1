package com.neurosim.graph.node;

import com.neurosim.graph.api.PortId;
import com.neurosim.graph.api.ProjectionId;
import com.neurosim.graph.fn.ModulationOperator;

/**
 * Directed edge between an output port and an input port (pathway) or a
 * parameter port (modulatory).
 *
 * A projection is owned by the composition's arena and referenced from both
 * endpoints by its id only.
 *
 * @param id       arena handle
 * @param kind     pathway or modulatory
 * @param sender   output port the value is read from
 * @param receiver input port (pathway) or parameter port (modulatory)
 * @param matrix   weights applied to the sender's value; identity for
 *                 modulatory projections
 * @param feedback true if the edge is excluded from cycle and level
 *                 computation
 * @param operator how a modulatory signal changes the parameter; null for
 *                 pathway projections
 */
public record Projection(ProjectionId id, Kind kind, PortId sender, PortId receiver, Matrix matrix,
        boolean feedback, ModulationOperator operator) {

    public enum Kind {
        PATHWAY,
        MODULATORY
    }

    public boolean isModulatory() {
        return kind == Kind.MODULATORY;
    }

    @Override
    public String toString() {
        return sender + " -> " + receiver + (kind == Kind.MODULATORY ? " [" + operator + "]" : " " + matrix)
                + (feedback ? " (feedback)" : "");
    }
}
