package com.neurosim.graph.api;

/**
 * Units of scheduling time, from finest to coarsest.
 *
 * A time step executes one consideration set, a pass offers every set one
 * time step, a trial is one or more passes and a run is a sequence of trials.
 */
public enum TimeScale {
    TIME_STEP,
    PASS,
    TRIAL,
    RUN
}
