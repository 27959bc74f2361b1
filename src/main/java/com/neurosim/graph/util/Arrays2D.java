package com.neurosim.graph.util;

import java.util.Arrays;

/** Helpers for the rectangular {@code double[][]} values passed around the engine. */
public final class Arrays2D {
    private Arrays2D() {
        // Utility class
    }

    /** Deep copy; {@code null} stays {@code null}. */
    public static double[][] copy(double[][] src) {
        if (src == null)
            return null;
        double[][] copy = new double[src.length][];
        for (int i = 0; i < src.length; i++)
            copy[i] = src[i].clone();
        return copy;
    }

    /** Wraps a single row. */
    public static double[][] row(double... values) {
        return new double[][] { values.clone() };
    }

    public static String toString(double[][] value) {
        return Arrays.deepToString(value);
    }
}
