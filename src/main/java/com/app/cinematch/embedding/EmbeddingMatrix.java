package com.app.cinematch.embedding;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable N x D matrix of movie embeddings, stored row-major as float32.
 * Similarities are raw dot products; normalization is whatever the
 * offline generator applied.
 */
public final class EmbeddingMatrix {

    private final int rows;
    private final int dimension;
    private final float[] data;

    public EmbeddingMatrix(int rows, int dimension, float[] data) {
        if (rows < 0 || dimension < 0) {
            throw new IllegalArgumentException("Negative matrix shape: " + rows + "x" + dimension);
        }
        if (data.length != (long) rows * dimension) {
            throw new IllegalArgumentException(String.format(
                    "Matrix data length %d does not match shape %dx%d", data.length, rows, dimension));
        }
        this.rows = rows;
        this.dimension = dimension;
        this.data = data.clone();
    }

    public static EmbeddingMatrix of(float[][] vectors) {
        int dim = vectors.length == 0 ? 0 : vectors[0].length;
        float[] flat = new float[vectors.length * dim];
        for (int i = 0; i < vectors.length; i++) {
            if (vectors[i].length != dim) {
                throw new IllegalArgumentException("Ragged embedding at row " + i);
            }
            System.arraycopy(vectors[i], 0, flat, i * dim, dim);
        }
        return new EmbeddingMatrix(vectors.length, dim, flat);
    }

    public int rows() {
        return rows;
    }

    public int dimension() {
        return dimension;
    }

    public double[] row(int row) {
        checkRow(row);
        double[] out = new double[dimension];
        int offset = row * dimension;
        for (int d = 0; d < dimension; d++) {
            out[d] = data[offset + d];
        }
        return out;
    }

    public double dot(int row, double[] vector) {
        checkRow(row);
        int offset = row * dimension;
        double sum = 0;
        for (int d = 0; d < dimension; d++) {
            sum += data[offset + d] * vector[d];
        }
        return sum;
    }

    public double dot(int a, int b) {
        checkRow(a);
        checkRow(b);
        int offsetA = a * dimension;
        int offsetB = b * dimension;
        double sum = 0;
        for (int d = 0; d < dimension; d++) {
            sum += (double) data[offsetA + d] * data[offsetB + d];
        }
        return sum;
    }

    /**
     * Dot product of every row against {@code vector}.
     */
    public double[] multiply(double[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException("Vector dimension " + vector.length + " != " + dimension);
        }
        double[] scores = new double[rows];
        for (int i = 0; i < rows; i++) {
            scores[i] = dot(i, vector);
        }
        return scores;
    }

    /**
     * Weighted average of the given rows. Weights must already sum to 1.
     */
    public double[] weightedAverage(List<Integer> rowIndices, double[] weights) {
        if (rowIndices.size() != weights.length) {
            throw new IllegalArgumentException("One weight per row required");
        }
        double[] centroid = new double[dimension];
        for (int k = 0; k < weights.length; k++) {
            int offset = rowIndices.get(k) * dimension;
            for (int d = 0; d < dimension; d++) {
                centroid[d] += weights[k] * data[offset + d];
            }
        }
        return centroid;
    }

    public double[] mean(List<Integer> rowIndices) {
        double[] weights = new double[rowIndices.size()];
        Arrays.fill(weights, 1.0 / rowIndices.size());
        return weightedAverage(rowIndices, weights);
    }

    private void checkRow(int row) {
        if (row < 0 || row >= rows) {
            throw new IndexOutOfBoundsException("Row " + row + " outside [0, " + rows + ")");
        }
    }
}
