package org.carball.tuner.cluster;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Agglomerative clustering with complete linkage, cut at a fixed number of clusters.
 */
public final class CompleteLinkage {

    private CompleteLinkage() {
        // Utility class - prevent instantiation
    }

    /**
     * Assigns every point a cluster label in {@code [0, clusterCount)}. Labels are numbered by the
     * smallest point index in each cluster, so the result does not depend on merge order. With fewer
     * points than clusters every point is its own cluster and the highest labels stay unused.
     */
    public static int[] assign(DistanceMatrix distances, int clusterCount) {
        if (clusterCount < 1) {
            throw new IllegalArgumentException("Cluster count must be at least 1, got " + clusterCount);
        }
        int n = distances.size();
        double[][] linkage = new double[n][n];
        List<List<Integer>> members = new ArrayList<>(n);
        boolean[] alive = new boolean[n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                linkage[i][j] = distances.get(i, j);
            }
            List<Integer> single = new ArrayList<>();
            single.add(i);
            members.add(single);
            alive[i] = true;
        }

        int remaining = n;
        while (remaining > clusterCount) {
            int bestA = -1;
            int bestB = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int a = 0; a < n; a++) {
                if (!alive[a]) {
                    continue;
                }
                for (int b = a + 1; b < n; b++) {
                    if (alive[b] && linkage[a][b] < bestDistance) {
                        bestDistance = linkage[a][b];
                        bestA = a;
                        bestB = b;
                    }
                }
            }

            members.get(bestA).addAll(members.get(bestB));
            alive[bestB] = false;
            for (int c = 0; c < n; c++) {
                if (alive[c] && c != bestA) {
                    double merged = Math.max(linkage[bestA][c], linkage[bestB][c]);
                    linkage[bestA][c] = merged;
                    linkage[c][bestA] = merged;
                }
            }
            remaining--;
        }

        List<List<Integer>> clusters = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (alive[i]) {
                clusters.add(members.get(i));
            }
        }
        clusters.sort(Comparator.comparingInt(cluster -> cluster.stream().mapToInt(Integer::intValue).min().orElse(0)));

        int[] labels = new int[n];
        for (int label = 0; label < clusters.size(); label++) {
            for (int point : clusters.get(label)) {
                labels[point] = label;
            }
        }
        return labels;
    }
}
