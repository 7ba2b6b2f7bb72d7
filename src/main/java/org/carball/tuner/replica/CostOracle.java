package org.carball.tuner.replica;

import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;

import java.util.List;

/**
 * What-if cost estimation against a single replica. Implementations hold exactly one simulated index
 * configuration at a time; every estimate reflects the configuration applied last.
 */
public interface CostOracle extends AutoCloseable {

    /**
     * Drops every simulated index, then simulates {@code indexes}.
     */
    void applyConfiguration(List<Index> indexes);

    /**
     * Planner cost of {@code query} under the currently simulated configuration.
     */
    double estimateCost(Query query);

    /**
     * Estimated on-disk size of {@code index} in bytes. Leaves the simulated configuration unchanged.
     */
    long estimateIndexSize(Index index);

    /**
     * Tables and columns visible on the replica.
     */
    DatabaseSchema listColumns();

    @Override
    void close();
}
