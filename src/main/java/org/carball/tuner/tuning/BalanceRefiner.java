package org.carball.tuner.tuning;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.tuning.IndexConfigurations;
import org.carball.tuner.model.tuning.Partition;
import org.carball.tuner.model.tuning.TuningState;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.replica.SimulatedConfiguration;

import java.util.List;
import java.util.Map;

/**
 * Balance-aware tuning refinement. Repeatedly relieves the most expensive replica by moving or
 * duplicating one of its queries to another replica, keeping the change only when the fleet's total
 * cost strictly drops.
 */
@Slf4j
public class BalanceRefiner {

    private final CostEvaluator evaluator;
    private final int maxIterations;

    public BalanceRefiner(CostEvaluator evaluator, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Iteration cap must be at least 1, got " + maxIterations);
        }
        this.evaluator = evaluator;
        this.maxIterations = maxIterations;
    }

    /**
     * @param start    configurations and partition produced by cluster-and-tune
     * @param baseline per-query cost with no indexes, keyed by query id
     */
    public TuningState refine(Workload workload, TuningState start, Map<String, Double> baseline) {
        log.info("Starting balance-aware refinement from total cost {}", start.totalCost());

        List<String> replicaIds = evaluator.replicaIds();
        List<SimulatedConfiguration> applied = evaluator.apply(start.configurations());
        Partition partition = start.partition();
        IndexConfigurations configurations = start.configurations();
        Map<String, Double> replicaCosts = evaluator.replicaCosts(applied, partition);
        double currentCost = replicaCosts.values().stream().mapToDouble(Double::doubleValue).sum();

        if (replicaIds.size() < 2) {
            log.info("Single replica, nothing to rebalance");
            return new TuningState(configurations, partition, currentCost, replicaCosts);
        }

        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            int worst = mostExpensive(replicaIds, replicaCosts);
            String worstId = replicaIds.get(worst);

            Partition bestFit = evaluator.bestFitPartition(applied, workload.getQueries());
            Query worstQuery = worstQuery(partition, bestFit, worstId, applied.get(worst));
            if (worstQuery == null) {
                log.debug("Iteration {}: no relocation candidate on replica {}", iteration, worstId);
                return new TuningState(configurations, partition, currentCost, replicaCosts);
            }

            double[] queryCosts = evaluator.costsAcrossReplicas(applied, worstQuery);
            int destination = chooseDestination(queryCosts, worst, baseline.get(worstQuery.getId()));
            String destinationId = replicaIds.get(destination);
            log.debug("Iteration {}: worst replica {} (cost {}), worst query {}, destination {}",
                    iteration, worstId, replicaCosts.get(worstId), worstQuery, destinationId);

            CostEvaluator.Evaluation moved = evaluator.tune(partition.withMove(worstQuery, worstId, destinationId));
            CostEvaluator.Evaluation duplicated = evaluator.tune(partition.withDuplicate(worstQuery, destinationId));
            CostEvaluator.Evaluation chosen = moved.totalCost() < duplicated.totalCost() ? moved : duplicated;
            log.debug("Iteration {}: current {}, move {}, duplicate {}",
                    iteration, currentCost, moved.totalCost(), duplicated.totalCost());

            if (chosen.totalCost() >= currentCost) {
                log.info("Balance-aware refinement converged after {} iterations with total cost {}", iteration, currentCost);
                return new TuningState(configurations, partition, currentCost, replicaCosts);
            }

            TuningState accepted = chosen.state();
            partition = accepted.partition();
            configurations = accepted.configurations();
            replicaCosts = accepted.replicaCosts();
            currentCost = accepted.totalCost();
            applied = chosen.isStillApplied() ? chosen.applied() : evaluator.apply(configurations);
            log.debug("Iteration {}: {} {} to {}, total cost now {}", iteration,
                    chosen == moved ? "moved" : "duplicated", worstQuery, destinationId, currentCost);
        }

        log.warn("Balance-aware refinement stopped after {} iterations; keeping total cost {}", maxIterations, currentCost);
        return new TuningState(configurations, partition, currentCost, replicaCosts);
    }

    private static int mostExpensive(List<String> replicaIds, Map<String, Double> replicaCosts) {
        int worst = 0;
        for (int r = 1; r < replicaIds.size(); r++) {
            if (replicaCosts.get(replicaIds.get(r)) > replicaCosts.get(replicaIds.get(worst))) {
                worst = r;
            }
        }
        return worst;
    }

    /**
     * Among the worst replica's queries that also fit best there, the one that costs most on it.
     */
    private static Query worstQuery(Partition partition, Partition bestFit, String worstId,
                                    SimulatedConfiguration worstReplica) {
        Query worst = null;
        double worstCost = Double.NEGATIVE_INFINITY;
        for (Query query : partition.queriesOf(worstId)) {
            if (!bestFit.contains(worstId, query)) {
                continue;
            }
            double cost = worstReplica.cost(query);
            if (cost > worstCost) {
                worst = query;
                worstCost = cost;
            }
        }
        return worst;
    }

    /**
     * The cheapest other replica where the query beats its no-index cost, or failing that the cheapest
     * other replica.
     */
    static int chooseDestination(double[] queryCosts, int worst, double baseline) {
        int helping = -1;
        int cheapest = -1;
        for (int r = 0; r < queryCosts.length; r++) {
            if (r == worst) {
                continue;
            }
            if (cheapest < 0 || queryCosts[r] < queryCosts[cheapest]) {
                cheapest = r;
            }
            if (queryCosts[r] < baseline && (helping < 0 || queryCosts[r] < queryCosts[helping])) {
                helping = r;
            }
        }
        return helping >= 0 ? helping : cheapest;
    }
}
