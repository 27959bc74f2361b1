package com.neurosim.graph.api;

/** Handle of a projection in a composition's projection table. */
public record ProjectionId(int index) {

    @Override
    public String toString() {
        return "projection#" + index;
    }
}
