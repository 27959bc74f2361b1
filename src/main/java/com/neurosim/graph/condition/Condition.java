package com.neurosim.graph.condition;

import com.neurosim.graph.api.NodeId;

/**
 * Predicate over the scheduling history.
 *
 * Node conditions gate whether a node fires at a time step; termination
 * conditions decide when a trial or run ends. See {@link Conditions} for the
 * standard set.
 */
@FunctionalInterface
public interface Condition {

    /**
     * @param owner The node the condition is attached to, or {@code null}
     *              for termination conditions.
     * @param clock The scheduling history of the context being advanced.
     */
    boolean isSatisfied(NodeId owner, SchedulingClock clock);
}
