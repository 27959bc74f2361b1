package com.neurosim.graph.condition;

import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.TimeScale;

import java.util.Set;

/**
 * Read-only view of the scheduling history of one execution context.
 * Conditions are evaluated against it.
 */
public interface SchedulingClock {

    /**
     * Current position on a time scale.
     *
     * TIME_STEP and PASS count from zero within the enclosing unit (pass and
     * trial respectively); TRIAL counts trials ever started on the context;
     * RUN counts {@code run} calls on the context. Before a unit completes
     * the value equals the number of completed units.
     */
    int time(TimeScale scale);

    /**
     * How often a node fired within the current unit of the given scale.
     */
    int calls(NodeId node, TimeScale scale);

    /**
     * How often {@code dependency} fired since {@code owner} last fired
     * (since the start of the run if the owner has not fired yet).
     */
    int callsSinceLastRun(NodeId owner, NodeId dependency);

    /** Whether the node's most recent firing reported itself finished. */
    boolean isFinished(NodeId node);

    /** Nodes currently scheduled, in queue order. */
    Set<NodeId> nodes();
}
