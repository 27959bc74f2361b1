package com.neurosim.graph.engine;

import com.neurosim.graph.api.ExecutionId;
import com.neurosim.graph.api.TrialResult;

import java.util.List;

/**
 * Results of one run, one {@link TrialResult} per completed trial.
 */
public record RunResult(ExecutionId executionId, List<TrialResult> trials) {

    public RunResult {
        trials = List.copyOf(trials);
    }

    public int size() {
        return trials.size();
    }

    public TrialResult trial(int index) {
        return trials.get(index);
    }

    /**
     * @throws IllegalStateException if no trial ran
     */
    public TrialResult last() {
        if (trials.isEmpty())
            throw new IllegalStateException("No trial completed");
        return trials.get(trials.size() - 1);
    }
}
