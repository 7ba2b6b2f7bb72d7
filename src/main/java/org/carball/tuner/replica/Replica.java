package org.carball.tuner.replica;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;

import java.util.List;

/**
 * A read replica and its cost oracle. Configuration changes and cost reads are serialised on the
 * replica, so different replicas can be driven from different threads.
 */
@Slf4j
public class Replica implements AutoCloseable {

    private final ReplicaEndpoint endpoint;
    private final CostOracle oracle;
    private long generation;
    private List<Index> configuration = List.of();

    public Replica(ReplicaEndpoint endpoint, CostOracle oracle) {
        this.endpoint = endpoint;
        this.oracle = oracle;
    }

    public String getId() {
        return endpoint.getId();
    }

    public synchronized List<Index> getConfiguration() {
        return configuration;
    }

    /**
     * Resets the replica and simulates {@code indexes}. Handles from earlier calls become stale.
     */
    public synchronized SimulatedConfiguration apply(List<Index> indexes) {
        generation++;
        configuration = List.of();
        try {
            oracle.applyConfiguration(indexes);
        } catch (CostOracleException e) {
            throw e.withContext(getId(), null);
        }
        configuration = List.copyOf(indexes);
        log.debug("Replica {} now simulates {} indexes (generation {})", getId(), indexes.size(), generation);
        return new SimulatedConfiguration(this, configuration, generation);
    }

    /**
     * Drops every simulated index.
     */
    public SimulatedConfiguration reset() {
        return apply(List.of());
    }

    synchronized boolean isCurrent(SimulatedConfiguration handle) {
        return handle.getGeneration() == generation;
    }

    synchronized double estimateCost(SimulatedConfiguration handle, Query query) {
        if (handle.getGeneration() != generation) {
            throw new StaleConfigurationException("Replica " + getId() + " was reconfigured (generation "
                    + generation + ") after configuration " + handle.getGeneration() + " was applied");
        }
        try {
            return oracle.estimateCost(query);
        } catch (CostOracleException e) {
            throw e.withContext(getId(), query.getId());
        }
    }

    public synchronized long estimateIndexSize(Index index) {
        try {
            return oracle.estimateIndexSize(index);
        } catch (CostOracleException e) {
            throw e.withContext(getId(), null);
        }
    }

    public synchronized DatabaseSchema listColumns() {
        try {
            return oracle.listColumns();
        } catch (CostOracleException e) {
            throw e.withContext(getId(), null);
        }
    }

    @Override
    public synchronized void close() {
        oracle.close();
    }

    @Override
    public String toString() {
        return "Replica(" + getId() + ")";
    }
}
