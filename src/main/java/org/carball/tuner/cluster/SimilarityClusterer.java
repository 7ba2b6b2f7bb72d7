package org.carball.tuner.cluster;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.workload.Query;

import java.util.ArrayList;
import java.util.List;

/**
 * Groups queries whose candidate index sets overlap, using complete-linkage clustering over Jaccard
 * distances.
 */
@Slf4j
public class SimilarityClusterer implements Clusterer {

    private final int maxIndexWidth;
    private final boolean parallel;

    public SimilarityClusterer(int maxIndexWidth, boolean parallel) {
        this.maxIndexWidth = maxIndexWidth;
        this.parallel = parallel;
    }

    @Override
    public List<List<Query>> cluster(List<Query> queries, int clusterCount) {
        DistanceMatrix distances = DistanceMatrix.of(queries, maxIndexWidth, parallel);
        int[] labels = CompleteLinkage.assign(distances, clusterCount);

        List<List<Query>> groups = new ArrayList<>(clusterCount);
        for (int i = 0; i < clusterCount; i++) {
            groups.add(new ArrayList<>());
        }
        for (int i = 0; i < labels.length; i++) {
            groups.get(labels[i]).add(queries.get(i));
        }

        if (queries.size() < clusterCount) {
            log.warn("Only {} queries for {} replicas; {} replicas start with an empty partition",
                    queries.size(), clusterCount, clusterCount - queries.size());
        }
        log.debug("Clustered {} queries into {}", queries.size(), groups);
        return groups;
    }
}
