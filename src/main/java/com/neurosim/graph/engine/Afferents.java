package com.neurosim.graph.engine;

import java.util.List;

/**
 * What a mechanism receives when it fires, already passed through the
 * projection matrices. Supplied by the scheduler from the published outputs
 * of the execution context.
 */
public interface Afferents {

    /** Afferents for a mechanism with no incoming projections and no input. */
    Afferents NONE = new Afferents() {
        @Override
        public List<double[]> inputContributions(int inputPort) {
            return List.of();
        }

        @Override
        public List<ModulatorySignal> modulatorySignals(int parameterPort) {
            return List.of();
        }
    };

    /**
     * Vectors arriving at an input port, external input included, in
     * projection order.
     */
    List<double[]> inputContributions(int inputPort);

    /** Signals arriving at a parameter port, in projection order. */
    List<ModulatorySignal> modulatorySignals(int parameterPort);
}
