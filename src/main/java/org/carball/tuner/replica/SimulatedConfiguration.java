package org.carball.tuner.replica;

import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;

import java.util.Collection;
import java.util.List;

/**
 * Handle to the index configuration a replica simulated on one {@link Replica#apply} call. Costs can
 * only be read through the handle, and only while it is still the replica's active configuration.
 */
public final class SimulatedConfiguration {

    private final Replica replica;
    private final List<Index> indexes;
    private final long generation;

    SimulatedConfiguration(Replica replica, List<Index> indexes, long generation) {
        this.replica = replica;
        this.indexes = List.copyOf(indexes);
        this.generation = generation;
    }

    public Replica getReplica() {
        return replica;
    }

    public List<Index> getIndexes() {
        return indexes;
    }

    long getGeneration() {
        return generation;
    }

    public boolean isCurrent() {
        return replica.isCurrent(this);
    }

    public double cost(Query query) {
        return replica.estimateCost(this, query);
    }

    public double totalCost(Collection<Query> queries) {
        double total = 0.0;
        for (Query query : queries) {
            total += cost(query);
        }
        return total;
    }

    @Override
    public String toString() {
        return replica.getId() + "@" + generation + indexes;
    }
}
