package com.neurosim.graph.api;

/**
 * Raised when a structural mutation is malformed: unknown or duplicate node,
 * projection between incompatible ports, matrix that does not fit its
 * endpoints. The composition keeps the state it had before the call.
 */
public class GraphStructureException extends IllegalArgumentException {

    public GraphStructureException(String message) {
        super(message);
    }
}
