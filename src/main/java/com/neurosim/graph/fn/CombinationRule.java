package com.neurosim.graph.fn;

import java.util.List;

/**
 * How an input port combines the vectors it receives from several afferents.
 */
public enum CombinationRule {
    SUM,
    PRODUCT,
    MEAN;

    /**
     * Combines equally sized contributions into a new vector.
     *
     * @param contributions At least one vector; all of the same length.
     * @return A freshly allocated combined vector.
     */
    public double[] combine(List<double[]> contributions) {
        double[] first = contributions.get(0);
        double[] out = first.clone();
        for (int c = 1; c < contributions.size(); c++) {
            double[] next = contributions.get(c);
            for (int i = 0; i < out.length; i++) {
                if (this == PRODUCT)
                    out[i] *= next[i];
                else
                    out[i] += next[i];
            }
        }
        if (this == MEAN && contributions.size() > 1) {
            for (int i = 0; i < out.length; i++)
                out[i] /= contributions.size();
        }
        return out;
    }
}
