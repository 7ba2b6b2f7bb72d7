package org.carball.tuner.tuning;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.advisor.AdvisorBudget;
import org.carball.tuner.advisor.IndexAdvisor;
import org.carball.tuner.advisor.InfeasibleBudgetException;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.tuning.IndexConfigurations;
import org.carball.tuner.model.tuning.Partition;
import org.carball.tuner.model.tuning.TuningState;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.replica.Replica;
import org.carball.tuner.replica.SimulatedConfiguration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Cost bookkeeping shared by the tuning stages. Every cost is read through the
 * {@link SimulatedConfiguration} handles of the configuration under evaluation.
 */
@Slf4j
public class CostEvaluator {

    private final List<Replica> replicas;
    private final IndexAdvisor advisor;
    private final AdvisorBudget budget;
    private final ReplicaWorkers workers;

    public CostEvaluator(List<Replica> replicas, IndexAdvisor advisor, AdvisorBudget budget, ReplicaWorkers workers) {
        if (replicas.isEmpty()) {
            throw new IllegalArgumentException("At least one replica is required");
        }
        this.replicas = List.copyOf(replicas);
        this.advisor = advisor;
        this.budget = budget;
        this.workers = workers;
    }

    public List<Replica> getReplicas() {
        return replicas;
    }

    public List<String> replicaIds() {
        return replicas.stream().map(Replica::getId).collect(Collectors.toList());
    }

    /**
     * Recommends a configuration for every replica's share of {@code partition}, applies it, and
     * measures the partition's cost under it.
     */
    public Evaluation tune(Partition partition) {
        List<ReplicaTuning> tuned = workers.map(replicas, replica -> {
            List<Query> queries = partition.queriesOf(replica.getId());
            List<Index> indexes = recommend(replica, queries);
            SimulatedConfiguration applied = replica.apply(indexes);
            return new ReplicaTuning(applied, applied.totalCost(queries));
        });

        Map<String, List<Index>> configurations = new LinkedHashMap<>();
        Map<String, Double> replicaCosts = new LinkedHashMap<>();
        List<SimulatedConfiguration> applied = new ArrayList<>();
        double total = 0.0;
        for (ReplicaTuning result : tuned) {
            String id = result.applied().getReplica().getId();
            configurations.put(id, result.applied().getIndexes());
            replicaCosts.put(id, result.cost());
            applied.add(result.applied());
            total += result.cost();
        }
        TuningState state = new TuningState(IndexConfigurations.of(configurations), partition.copy(), total, replicaCosts);
        return new Evaluation(state, applied);
    }

    private List<Index> recommend(Replica replica, List<Query> queries) {
        try {
            return advisor.recommend(replica, queries, budget);
        } catch (InfeasibleBudgetException e) {
            log.warn("Budget infeasible on replica {}: {}. Continuing without indexes", replica.getId(), e.getMessage());
            return List.of();
        }
    }

    /**
     * Applies {@code configurations} to every replica.
     */
    public List<SimulatedConfiguration> apply(IndexConfigurations configurations) {
        return workers.map(replicas, replica -> replica.apply(configurations.forReplica(replica.getId())));
    }

    /**
     * Cost of every query on every replica: {@code matrix[replica][query]}.
     */
    public double[][] costMatrix(List<SimulatedConfiguration> applied, List<Query> queries) {
        List<double[]> rows = workers.map(applied, configuration -> {
            double[] row = new double[queries.size()];
            for (int q = 0; q < queries.size(); q++) {
                row[q] = configuration.cost(queries.get(q));
            }
            return row;
        });
        return rows.toArray(new double[0][]);
    }

    public double[] costsAcrossReplicas(List<SimulatedConfiguration> applied, Query query) {
        double[] costs = new double[applied.size()];
        for (int r = 0; r < applied.size(); r++) {
            costs[r] = applied.get(r).cost(query);
        }
        return costs;
    }

    /**
     * Assigns each query to the replica where it is cheapest under {@code applied}; ties go to the
     * replica listed first.
     */
    public Partition bestFitPartition(List<SimulatedConfiguration> applied, List<Query> queries) {
        double[][] costs = costMatrix(applied, queries);
        Partition partition = Partition.empty(replicaIds());
        for (int q = 0; q < queries.size(); q++) {
            int best = 0;
            for (int r = 1; r < costs.length; r++) {
                if (costs[r][q] < costs[best][q]) {
                    best = r;
                }
            }
            partition.assign(replicas.get(best).getId(), queries.get(q));
        }
        return partition;
    }

    public Map<String, Double> replicaCosts(List<SimulatedConfiguration> applied, Partition partition) {
        List<Double> costs = workers.map(applied,
                configuration -> configuration.totalCost(partition.queriesOf(configuration.getReplica().getId())));
        Map<String, Double> byReplica = new LinkedHashMap<>();
        for (int r = 0; r < applied.size(); r++) {
            byReplica.put(applied.get(r).getReplica().getId(), costs.get(r));
        }
        return byReplica;
    }

    /**
     * Cost of every query with no index at all, measured on the first replica. Leaves that replica
     * without simulated indexes.
     */
    public Map<String, Double> baselineCosts(List<Query> queries) {
        Replica reference = replicas.get(0);
        SimulatedConfiguration bare = reference.reset();
        Map<String, Double> baseline = new LinkedHashMap<>();
        for (Query query : queries) {
            baseline.put(query.getId(), bare.cost(query));
        }
        log.debug("Baseline costs measured on replica {}: {}", reference.getId(), baseline);
        return baseline;
    }

    /**
     * A tuned state together with the configuration handles that were applied to measure it.
     */
    public record Evaluation(TuningState state, List<SimulatedConfiguration> applied) {

        public double totalCost() {
            return state.totalCost();
        }

        public boolean isStillApplied() {
            return applied.stream().allMatch(SimulatedConfiguration::isCurrent);
        }
    }

    private record ReplicaTuning(SimulatedConfiguration applied, double cost) {}
}
