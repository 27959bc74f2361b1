package com.neurosim.graph.engine;

import com.neurosim.graph.fn.ModulationOperator;

/** One scalar modulatory signal and the operator it applies with. */
public record ModulatorySignal(double value, ModulationOperator operator) {
}
