package com.neurosim.graph.node;

/**
 * Steps of one firing of a mechanism. INTEGRATING repeats while a stateful
 * mechanism has not met its termination condition.
 */
public enum ExecutionPhase {
    IDLE,
    AGGREGATING_INPUT,
    MODULATING_PARAMETERS,
    COMPUTING,
    INTEGRATING,
    PUBLISHING_OUTPUT
}
