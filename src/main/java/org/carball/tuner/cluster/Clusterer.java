package org.carball.tuner.cluster;

import org.carball.tuner.model.workload.Query;

import java.util.List;

/**
 * Splits a workload into a fixed number of disjoint groups of similar queries.
 */
public interface Clusterer {

    /**
     * @return exactly {@code clusterCount} groups; a group is empty only when there are fewer queries
     *         than groups
     */
    List<List<Query>> cluster(List<Query> queries, int clusterCount);
}
