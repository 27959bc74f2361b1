package com.neurosim.graph.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outputs of one trial: the output-port values of every TERMINAL node as they
 * stood when the trial ended.
 */
public final class TrialResult {
    private final int trial;
    private final int passes;
    private final Map<NodeId, double[][]> outputs;

    public TrialResult(int trial, int passes, Map<NodeId, double[][]> outputs) {
        this.trial = trial;
        this.passes = passes;
        Map<NodeId, double[][]> copy = new LinkedHashMap<>();
        for (var e : outputs.entrySet())
            copy.put(e.getKey(), deepCopy(e.getValue()));
        this.outputs = Collections.unmodifiableMap(copy);
    }

    /** Zero-based index of the trial within its run. */
    public int trial() {
        return trial;
    }

    /** Number of passes the trial took. */
    public int passes() {
        return passes;
    }

    /** Copy of the output-port values of each terminal node, in node order. */
    public Map<NodeId, double[][]> outputs() {
        Map<NodeId, double[][]> copy = new LinkedHashMap<>();
        for (var e : outputs.entrySet())
            copy.put(e.getKey(), deepCopy(e.getValue()));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Output-port values of one terminal node.
     *
     * @throws IllegalArgumentException if the node was not terminal in this trial.
     */
    public double[][] outputsOf(NodeId node) {
        double[][] values = outputs.get(node);
        if (values == null)
            throw new IllegalArgumentException("Not a terminal node of this trial: " + node);
        return deepCopy(values);
    }

    /** First element of the first output port of a terminal node. */
    public double scalar(NodeId node) {
        double[][] values = outputs.get(node);
        if (values == null)
            throw new IllegalArgumentException("Not a terminal node of this trial: " + node);
        return values[0][0];
    }

    private static double[][] deepCopy(double[][] values) {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < copy.length; i++)
            copy[i] = values[i].clone();
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Trial ").append(trial).append(" (").append(passes).append(" passes)");
        for (var e : outputs.entrySet())
            sb.append(' ').append(e.getKey().name()).append('=').append(Arrays.deepToString(e.getValue()));
        return sb.toString();
    }
}
