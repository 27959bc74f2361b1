package com.neurosim.graph.api;

/**
 * Stable handle of a mechanism inside one {@code Composition}.
 *
 * The index addresses the composition's node table and is never reused, even
 * after the node is removed. The name is carried for diagnostics only.
 */
public record NodeId(int index, String name) {

    @Override
    public String toString() {
        return name;
    }
}
