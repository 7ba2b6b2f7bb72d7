package org.carball.tuner.cluster;

import org.carball.tuner.model.workload.Query;

import java.util.List;
import java.util.stream.IntStream;

/**
 * Symmetric matrix of pairwise query distances with a zero diagonal.
 */
public final class DistanceMatrix {

    private final double[][] values;

    public DistanceMatrix(double[][] values) {
        int n = values.length;
        this.values = new double[n][];
        for (int i = 0; i < n; i++) {
            if (values[i].length != n) {
                throw new IllegalArgumentException("Distance matrix must be square, row " + i + " has "
                        + values[i].length + " entries for " + n + " rows");
            }
            this.values[i] = values[i].clone();
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (Double.compare(values[i][j], values[j][i]) != 0) {
                    throw new IllegalArgumentException("Distance matrix is not symmetric at (" + i + "," + j + ")");
                }
            }
        }
    }

    /**
     * Jaccard distances between the queries' candidate index sets. Rows are independent, so they may be
     * filled in parallel.
     */
    public static DistanceMatrix of(List<Query> queries, int maxIndexWidth, boolean parallel) {
        int n = queries.size();
        double[][] values = new double[n][n];
        IntStream rows = IntStream.range(0, n);
        (parallel ? rows.parallel() : rows).forEach(i -> {
            for (int j = i + 1; j < n; j++) {
                values[i][j] = queries.get(i).distance(queries.get(j), maxIndexWidth);
            }
        });
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                values[j][i] = values[i][j];
            }
        }
        return new DistanceMatrix(values);
    }

    public int size() {
        return values.length;
    }

    public double get(int i, int j) {
        return values[i][j];
    }
}
