package org.carball.tuner.testing;

import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.replica.CostOracle;
import org.carball.tuner.replica.CostOracleException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory cost oracle. A query costs its base cost (100 unless set) times the replica speed, and
 * every simulated index whose leading column the query filters on takes 50% off, 60% when the second
 * column matches as well. Index size defaults to 1000 bytes per column.
 */
public class FakeCostOracle implements CostOracle {

    private final DatabaseSchema schema;
    private final double speed;
    private final Map<String, Double> baseCosts = new HashMap<>();
    private final Map<Index, Long> sizes = new HashMap<>();
    private final Deque<CostOracleException> scheduledFailures = new ArrayDeque<>();
    private String failingQueryId;
    private List<Index> active = List.of();
    private boolean closed;

    private final AtomicInteger applyCalls = new AtomicInteger();
    private final AtomicInteger costCalls = new AtomicInteger();

    public FakeCostOracle(DatabaseSchema schema) {
        this(schema, 1.0);
    }

    public FakeCostOracle(DatabaseSchema schema, double speed) {
        this.schema = schema;
        this.speed = speed;
    }

    public FakeCostOracle baseCost(String queryId, double cost) {
        baseCosts.put(queryId, cost);
        return this;
    }

    public FakeCostOracle indexSize(Index index, long bytes) {
        sizes.put(index, bytes);
        return this;
    }

    public FakeCostOracle failNextCostCalls(int count, boolean transientFailure) {
        for (int i = 0; i < count; i++) {
            scheduledFailures.add(new CostOracleException("simulated failure", null, transientFailure));
        }
        return this;
    }

    public FakeCostOracle failOnQuery(String queryId) {
        this.failingQueryId = queryId;
        return this;
    }

    @Override
    public synchronized void applyConfiguration(List<Index> indexes) {
        applyCalls.incrementAndGet();
        active = List.copyOf(indexes);
    }

    @Override
    public synchronized double estimateCost(Query query) {
        costCalls.incrementAndGet();
        if (!scheduledFailures.isEmpty()) {
            throw scheduledFailures.poll();
        }
        if (query.getId().equals(failingQueryId)) {
            throw new CostOracleException("syntax error in " + query.getId(), null, false);
        }

        double cost = baseCosts.getOrDefault(query.getId(), 100.0) * speed;
        for (Index index : active) {
            cost *= factor(index, query);
        }
        return cost;
    }

    private static double factor(Index index, Query query) {
        int matched = 0;
        for (Column column : index.getColumns()) {
            if (!query.getColumns().contains(column)) {
                break;
            }
            matched++;
        }
        if (matched == 0) {
            return 1.0;
        }
        return 1.0 - Math.min(0.9, 0.4 + 0.1 * matched);
    }

    @Override
    public synchronized long estimateIndexSize(Index index) {
        return sizes.getOrDefault(index, 1000L * index.width());
    }

    @Override
    public DatabaseSchema listColumns() {
        return schema;
    }

    @Override
    public synchronized void close() {
        closed = true;
    }

    public synchronized List<Index> getActive() {
        return active;
    }

    public int getApplyCalls() {
        return applyCalls.get();
    }

    public int getCostCalls() {
        return costCalls.get();
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
