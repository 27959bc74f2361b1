package com.neurosim.graph.engine;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.condition.SchedulingClock;
import com.neurosim.graph.node.Mechanism;
import com.neurosim.graph.node.MechanismState;

import java.util.HashMap;
import java.util.Map;

/**
 * All run-time state kept under one {@link ExecutionId}: a
 * {@link MechanismState} per node plus the scheduling counters.
 *
 * Contexts never share mutable data, so several of them can be advanced
 * against the same topology independently.
 */
public final class ExecutionContext {
    private final ExecutionId id;
    private Map<NodeId, MechanismState> states = new HashMap<>();
    private ClockState clock = new ClockState();

    ExecutionContext(ExecutionId id) {
        this.id = id;
    }

    public ExecutionId id() {
        return id;
    }

    public SchedulingClock clock() {
        return clock;
    }

    ClockState clockState() {
        return clock;
    }

    /** State of a node, created from the mechanism's defaults on first access. */
    MechanismState state(NodeId node, Mechanism m) {
        return states.computeIfAbsent(node, k -> MechanismState.initial(m));
    }

    /** State of a node if it has one yet. */
    public MechanismState existingState(NodeId node) {
        return states.get(node);
    }

    void forget(NodeId node) {
        states.remove(node);
        clock.forget(node);
    }

    /** Deep copy of everything, restorable with {@link #restore(Snapshot)}. */
    Snapshot snapshot() {
        Map<NodeId, MechanismState> copy = new HashMap<>();
        for (var e : states.entrySet())
            copy.put(e.getKey(), e.getValue().copy());
        return new Snapshot(copy, clock.copy());
    }

    void restore(Snapshot snapshot) {
        Map<NodeId, MechanismState> copy = new HashMap<>();
        for (var e : snapshot.states().entrySet())
            copy.put(e.getKey(), e.getValue().copy());
        this.states = copy;
        this.clock = snapshot.clock().copy();
    }

    record Snapshot(Map<NodeId, MechanismState> states, ClockState clock) {
    }
}
