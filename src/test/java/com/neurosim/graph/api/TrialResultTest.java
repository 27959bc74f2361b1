package com.neurosim.graph.api;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.*;

public class TrialResultTest {
    private static final double EPS = 1e-12;

    private final NodeId out = new NodeId(3, "OUT");

    @Test
    public void testValuesAreCopiedInAndOut() {
        double[][] values = { { 1.0, 2.0 } };
        TrialResult result = new TrialResult(0, 1, Map.of(out, values));

        values[0][0] = 7.0;
        result.outputsOf(out)[0][1] = 7.0;
        result.outputs().get(out)[0][0] = 7.0;

        assertArrayEquals(new double[] { 1.0, 2.0 }, result.outputsOf(out)[0], EPS);
        assertEquals(1.0, result.scalar(out), EPS);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownNodeRejected() {
        new TrialResult(0, 1, Map.of(out, new double[][] { { 1.0 } })).scalar(new NodeId(0, "A"));
    }

    @Test
    public void testToStringListsOutputs() {
        TrialResult result = new TrialResult(2, 3, Map.of(out, new double[][] { { 1.5 } }));
        assertEquals("Trial 2 (3 passes) OUT=[[1.5]]", result.toString());
    }
}
