package com.neurosim.graph.node;

import com.neurosim.graph.api.GraphStructureException;

import java.util.Arrays;

/**
 * Weight matrix of a pathway projection.
 *
 * The receiver vector is {@code r[j] = sum_i s[i] * M[i][j]}. Identity and
 * scalar matrices are element-wise and need sender and receiver of equal
 * length. Hollow and auto/hetero matrices are square too. A full matrix
 * takes any shape.
 */
public final class Matrix {

    public enum Kind {
        IDENTITY,
        SCALAR,
        FULL,
        HOLLOW,
        AUTO_HETERO,
        EXPLICIT
    }

    private static final Matrix IDENTITY = new Matrix(Kind.IDENTITY, 1.0, null);

    private final Kind kind;
    private final double weight;
    // off-diagonal weight of AUTO_HETERO
    private final double hetero;
    private final double[][] weights;

    private Matrix(Kind kind, double weight, double[][] weights) {
        this(kind, weight, 0.0, weights);
    }

    private Matrix(Kind kind, double weight, double hetero, double[][] weights) {
        this.kind = kind;
        this.weight = weight;
        this.hetero = hetero;
        this.weights = weights;
    }

    public static Matrix identity() {
        return IDENTITY;
    }

    /** Diagonal matrix with every diagonal entry equal to w. */
    public static Matrix scalar(double w) {
        return new Matrix(Kind.SCALAR, w, null);
    }

    /** Every sender element feeds every receiver element with weight w. */
    public static Matrix full(double w) {
        return new Matrix(Kind.FULL, w, null);
    }

    /** Off-diagonal entries w, diagonal 0. Typical for recurrent inhibition. */
    public static Matrix hollow(double w) {
        return new Matrix(Kind.HOLLOW, w, null);
    }

    /**
     * Diagonal entries {@code auto}, off-diagonal entries {@code hetero}: the
     * usual recurrent self-projection, e.g. {@code autoHetero(1, -0.5)} for
     * self-excitation with mutual inhibition.
     */
    public static Matrix autoHetero(double auto, double hetero) {
        return new Matrix(Kind.AUTO_HETERO, auto, hetero, null);
    }

    /**
     * Explicit weights, one row per sender element and one column per
     * receiver element.
     */
    public static Matrix of(double[][] weights) {
        if (weights.length == 0)
            throw new GraphStructureException("Matrix needs at least one row");
        int cols = weights[0].length;
        double[][] copy = new double[weights.length][];
        for (int i = 0; i < weights.length; i++) {
            if (weights[i].length != cols)
                throw new GraphStructureException("Matrix is not rectangular: row " + i + " has "
                        + weights[i].length + " columns, expected " + cols);
            copy[i] = weights[i].clone();
        }
        return new Matrix(Kind.EXPLICIT, Double.NaN, copy);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Checks that the matrix maps a sender vector of the given length onto a
     * receiver of the given length.
     *
     * @throws GraphStructureException if it does not.
     */
    public void checkDimensions(int senderLength, int receiverLength) {
        switch (kind) {
            case IDENTITY, SCALAR, HOLLOW, AUTO_HETERO -> {
                if (senderLength != receiverLength)
                    throw new GraphStructureException(kind + " matrix needs equal lengths, got sender "
                            + senderLength + " and receiver " + receiverLength);
            }
            case FULL -> {
                // any shape
            }
            case EXPLICIT -> {
                if (weights.length != senderLength || weights[0].length != receiverLength)
                    throw new GraphStructureException("Matrix is " + weights.length + "x" + weights[0].length
                            + " but sender has " + senderLength + " and receiver " + receiverLength + " elements");
            }
        }
    }

    /**
     * Transforms a sender vector into a freshly allocated receiver vector.
     */
    public double[] apply(double[] sender, int receiverLength) {
        double[] out = new double[receiverLength];
        switch (kind) {
            case IDENTITY -> System.arraycopy(sender, 0, out, 0, receiverLength);
            case SCALAR -> {
                for (int i = 0; i < receiverLength; i++)
                    out[i] = weight * sender[i];
            }
            case FULL -> {
                double sum = 0.0;
                for (double s : sender)
                    sum += s;
                Arrays.fill(out, weight * sum);
            }
            case HOLLOW -> {
                double sum = 0.0;
                for (double s : sender)
                    sum += s;
                for (int j = 0; j < receiverLength; j++)
                    out[j] = weight * (sum - sender[j]);
            }
            case AUTO_HETERO -> {
                double sum = 0.0;
                for (double s : sender)
                    sum += s;
                for (int j = 0; j < receiverLength; j++)
                    out[j] = weight * sender[j] + hetero * (sum - sender[j]);
            }
            case EXPLICIT -> {
                for (int i = 0; i < sender.length; i++) {
                    double s = sender[i];
                    double[] row = weights[i];
                    for (int j = 0; j < receiverLength; j++)
                        out[j] += s * row[j];
                }
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case IDENTITY -> "identity";
            case SCALAR -> "scalar(" + weight + ")";
            case FULL -> "full(" + weight + ")";
            case HOLLOW -> "hollow(" + weight + ")";
            case AUTO_HETERO -> "autoHetero(" + weight + ", " + hetero + ")";
            case EXPLICIT -> Arrays.deepToString(weights);
        };
    }
}
