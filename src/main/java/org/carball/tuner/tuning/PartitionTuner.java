package org.carball.tuner.tuning;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.cluster.Clusterer;
import org.carball.tuner.model.tuning.Partition;
import org.carball.tuner.model.tuning.TuningState;
import org.carball.tuner.model.workload.Workload;

import java.util.ArrayList;
import java.util.List;

/**
 * Index utilization-based clustering and tuning. Seeds one partition per replica from query
 * similarity, then alternates between tuning every replica for its partition and reassigning each
 * query to the replica where it is cheapest, for as long as the total cost strictly drops.
 */
@Slf4j
public class PartitionTuner {

    private final Clusterer clusterer;
    private final CostEvaluator evaluator;
    private final int maxIterations;

    public PartitionTuner(Clusterer clusterer, CostEvaluator evaluator, int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("Iteration cap must be at least 1, got " + maxIterations);
        }
        this.clusterer = clusterer;
        this.evaluator = evaluator;
        this.maxIterations = maxIterations;
    }

    public Outcome tune(Workload workload) {
        log.info("Starting cluster-and-tune for {} queries on {} replicas",
                workload.size(), evaluator.getReplicas().size());

        List<String> replicaIds = evaluator.replicaIds();
        Partition seeded = Partition.of(replicaIds, clusterer.cluster(workload.getQueries(), replicaIds.size()));
        CostEvaluator.Evaluation current = evaluator.tune(seeded);
        TuningState best = current.state();

        List<Double> accepted = new ArrayList<>();
        accepted.add(best.totalCost());
        log.debug("Clustered partition {} costs {}", seeded, best.totalCost());

        int iteration = 0;
        boolean converged = false;
        while (iteration < maxIterations) {
            iteration++;
            // current's configurations are still applied: the best-fit read happens right after tune()
            Partition bestFit = evaluator.bestFitPartition(current.applied(), workload.getQueries());
            CostEvaluator.Evaluation next = evaluator.tune(bestFit);
            log.debug("Iteration {}: best-fit cost {} against best {}", iteration, next.totalCost(), best.totalCost());

            if (next.totalCost() < best.totalCost()) {
                best = next.state();
                accepted.add(best.totalCost());
                current = next;
            } else {
                converged = true;
                break;
            }
        }

        if (!converged) {
            log.warn("Cluster-and-tune stopped after {} iterations without converging; keeping cost {}",
                    maxIterations, best.totalCost());
        }
        log.info("Cluster-and-tune finished after {} iterations with total cost {}", iteration, best.totalCost());
        return new Outcome(best, List.copyOf(accepted), iteration);
    }

    /**
     * The lowest-cost state found, and the total cost of every accepted state in acceptance order.
     */
    public record Outcome(TuningState best, List<Double> acceptedCosts, int iterations) {}
}
