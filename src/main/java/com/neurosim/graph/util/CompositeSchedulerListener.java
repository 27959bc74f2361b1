package com.neurosim.graph.util;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.ExecutionResult;
import com.neurosim.graph.api.NodeId;
import com.neurosim.graph.api.SchedulerListener;
import com.neurosim.graph.condition.SchedulingClock;

import java.util.Arrays;

/**
 * Fans scheduler events out to several {@link SchedulerListener} instances
 * with allocation-free iteration.
 */
public class CompositeSchedulerListener implements SchedulerListener {
    private SchedulerListener[] listeners = new SchedulerListener[0];

    public void add(SchedulerListener listener) {
        SchedulerListener[] old = listeners;
        SchedulerListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public boolean remove(SchedulerListener listener) {
        SchedulerListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                SchedulerListener[] next = new SchedulerListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onTrialStart(ExecutionId id, SchedulingClock clock) {
        for (SchedulerListener l : listeners)
            l.onTrialStart(id, clock);
    }

    @Override
    public void onPassStart(ExecutionId id, SchedulingClock clock) {
        for (SchedulerListener l : listeners)
            l.onPassStart(id, clock);
    }

    @Override
    public void onTimeStepStart(ExecutionId id, SchedulingClock clock) {
        for (SchedulerListener l : listeners)
            l.onTimeStepStart(id, clock);
    }

    @Override
    public void onNodeExecuted(ExecutionId id, SchedulingClock clock, NodeId node, ExecutionResult result,
            long durationNanos) {
        for (SchedulerListener l : listeners)
            l.onNodeExecuted(id, clock, node, result, durationNanos);
    }

    @Override
    public void onNodeError(ExecutionId id, SchedulingClock clock, NodeId node, Throwable error) {
        for (SchedulerListener l : listeners)
            l.onNodeError(id, clock, node, error);
    }

    @Override
    public void onTimeStepEnd(ExecutionId id, SchedulingClock clock) {
        for (SchedulerListener l : listeners)
            l.onTimeStepEnd(id, clock);
    }

    @Override
    public void onPassEnd(ExecutionId id, SchedulingClock clock) {
        for (SchedulerListener l : listeners)
            l.onPassEnd(id, clock);
    }

    @Override
    public void onTrialEnd(ExecutionId id, SchedulingClock clock) {
        for (SchedulerListener l : listeners)
            l.onTrialEnd(id, clock);
    }
}
