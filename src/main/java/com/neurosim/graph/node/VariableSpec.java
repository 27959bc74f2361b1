package com.neurosim.graph.node;

/**
 * Which slice of its mechanism's value an output port reads: one row, or the
 * whole value flattened row by row.
 */
public record VariableSpec(int row) {
    private static final int FLATTENED = -1;

    public VariableSpec {
        if (row < FLATTENED)
            throw new IllegalArgumentException("Row index must be >= 0 or -1 (flattened), got " + row);
    }

    public static VariableSpec row(int index) {
        if (index < 0)
            throw new IllegalArgumentException("Row index must be >= 0, got " + index);
        return new VariableSpec(index);
    }

    public static VariableSpec flattened() {
        return new VariableSpec(FLATTENED);
    }

    public boolean isFlattened() {
        return row == FLATTENED;
    }

    /** Reads the slice out of a value; the result is a fresh array. */
    public double[] read(double[][] value) {
        if (!isFlattened())
            return value[row].clone();
        int n = 0;
        for (double[] r : value)
            n += r.length;
        double[] flat = new double[n];
        int k = 0;
        for (double[] r : value) {
            System.arraycopy(r, 0, flat, k, r.length);
            k += r.length;
        }
        return flat;
    }

    /** Length of the slice for a value with the given row lengths. */
    public int length(int[] rowLengths) {
        if (!isFlattened())
            return rowLengths[row];
        int n = 0;
        for (int len : rowLengths)
            n += len;
        return n;
    }

    @Override
    public String toString() {
        return isFlattened() ? "flattened" : "row(" + row + ")";
    }
}
