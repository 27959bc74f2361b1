package com.neurosim.graph.api;

/**
 * Raised when a mechanism or run is configured inconsistently, e.g. a
 * termination threshold without integrator mode or clip bounds in the wrong
 * order. Thrown before any trial runs.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
