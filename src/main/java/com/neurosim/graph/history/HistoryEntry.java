package com.neurosim.graph.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * One recorded output-port value.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class HistoryEntry {
    private String executionId;
    private int trial;
    private int pass;
    private int timeStep;
    private String node;
    private int port;
    private double[] value;
}
