package com.neurosim.graph.api;

/** The three kinds of port a mechanism owns. */
public enum PortKind {
    INPUT,
    PARAMETER,
    OUTPUT
}
