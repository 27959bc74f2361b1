package com.neurosim.graph.api;

/**
 * Raised during execution when a port receives a vector whose length differs
 * from the one it was built for.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(String message) {
        super(message);
    }
}
