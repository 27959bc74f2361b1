package com.neurosim.graph.api;

/**
 * Structural role of a node, derived from the graph and its feedback
 * designations. A node may hold several roles at once.
 */
public enum NodeRole {
    /** No non-feedback parent outside its own strongly connected component. */
    ORIGIN,
    /** No non-feedback child outside its own strongly connected component. */
    TERMINAL,
    /** None of the other roles. */
    INTERNAL,
    /** Member of a strongly connected component with more than one node. */
    CYCLE,
    /** Sender of at least one projection explicitly marked as feedback. */
    FEEDBACK_SENDER,
    /** Receiver of at least one projection explicitly marked as feedback. */
    FEEDBACK_RECEIVER
}
