package com.neurosim.graph.api;

import java.util.List;

/**
 * Raised when a trial fails. The execution context has already been rolled
 * back to the state it had when the failed trial started; the results of the
 * trials that completed before it are carried here.
 */
public class TrialExecutionException extends RuntimeException {
    private final int trial;
    private final transient List<TrialResult> completedTrials;

    public TrialExecutionException(int trial, List<TrialResult> completedTrials, Throwable cause) {
        super("Trial " + trial + " failed: " + cause.getMessage(), cause);
        this.trial = trial;
        this.completedTrials = List.copyOf(completedTrials);
    }

    /** Zero-based index, within the run, of the trial that failed. */
    public int trial() {
        return trial;
    }

    /** Results of the trials completed before the failure, in order. */
    public List<TrialResult> completedTrials() {
        return completedTrials;
    }
}
