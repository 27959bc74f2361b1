package com.neurosim.graph.api;

import com.neurosim.graph.condition.SchedulingClock;

/**
 * Observability interface for the trial scheduler.
 *
 * Implementations receive TIME_STEP, PASS and TRIAL level progress events
 * plus one callback per node firing. Callbacks run synchronously on the
 * thread driving the run, inside the trial, so they should be cheap and must
 * not mutate the composition.
 */
public interface SchedulerListener {

    /**
     * Called before the first pass of a trial.
     *
     * @param id    The execution context being advanced.
     * @param clock Scheduling counters at the start of the trial.
     */
    void onTrialStart(ExecutionId id, SchedulingClock clock);

    void onPassStart(ExecutionId id, SchedulingClock clock);

    void onTimeStepStart(ExecutionId id, SchedulingClock clock);

    /**
     * Called after a node has fired. The node's new outputs are still
     * buffered at this point; they become visible to other nodes when the
     * time step ends.
     *
     * @param id            The execution context.
     * @param clock         Scheduling counters, not yet including this firing.
     * @param node          The node that fired.
     * @param result        Value, outputs and iteration count of the firing.
     * @param durationNanos Wall time spent inside the node.
     */
    void onNodeExecuted(ExecutionId id, SchedulingClock clock, NodeId node, ExecutionResult result,
            long durationNanos);

    /**
     * Called when a node fails. The trial is aborted right after this call.
     */
    void onNodeError(ExecutionId id, SchedulingClock clock, NodeId node, Throwable error);

    void onTimeStepEnd(ExecutionId id, SchedulingClock clock);

    void onPassEnd(ExecutionId id, SchedulingClock clock);

    void onTrialEnd(ExecutionId id, SchedulingClock clock);
}
