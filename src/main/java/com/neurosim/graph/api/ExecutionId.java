package com.neurosim.graph.api;

import java.util.Objects;

/**
 * Opaque key of an execution context.
 *
 * Every context keeps its own variables, values, previous values, modulated
 * parameters and scheduling counters, so the same topology can be advanced
 * under several keys without one run observing another.
 */
public record ExecutionId(String key) {

    /** Context used when a run does not name one. */
    public static final ExecutionId DEFAULT = new ExecutionId("default");

    public ExecutionId {
        Objects.requireNonNull(key, "key");
    }

    public static ExecutionId of(String key) {
        return new ExecutionId(key);
    }

    @Override
    public String toString() {
        return key;
    }
}
