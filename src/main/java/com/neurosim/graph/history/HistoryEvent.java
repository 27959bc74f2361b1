package com.neurosim.graph.history;

/**
 * Mutable ring-buffer slot carrying one output-port value from the
 * scheduler thread to the recorder's consumer thread.
 *
 * Instances are pre-allocated by the ring buffer and reused; the producer
 * hands over a fresh copy of the value array so the consumer never sees a
 * buffer the engine still writes to.
 */
public final class HistoryEvent {
    private String executionId;
    private int trial;
    private int pass;
    private int timeStep;
    private String node;
    private int port;
    private double[] value;

    void set(String executionId, int trial, int pass, int timeStep, String node, int port, double[] value) {
        this.executionId = executionId;
        this.trial = trial;
        this.pass = pass;
        this.timeStep = timeStep;
        this.node = node;
        this.port = port;
        this.value = value;
    }

    HistoryEntry toEntry() {
        HistoryEntry e = new HistoryEntry();
        e.setExecutionId(executionId);
        e.setTrial(trial);
        e.setPass(pass);
        e.setTimeStep(timeStep);
        e.setNode(node);
        e.setPort(port);
        e.setValue(value);
        return e;
    }

    void clear() {
        executionId = null;
        node = null;
        value = null;
        trial = pass = timeStep = port = 0;
    }
}
