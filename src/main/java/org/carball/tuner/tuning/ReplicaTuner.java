package org.carball.tuner.tuning;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.advisor.AdvisorBudget;
import org.carball.tuner.advisor.IndexAdvisor;
import org.carball.tuner.cluster.SimilarityClusterer;
import org.carball.tuner.config.TuningParameters;
import org.carball.tuner.model.tuning.RoutingTable;
import org.carball.tuner.model.tuning.TuningResult;
import org.carball.tuner.model.tuning.TuningState;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.replica.CostOracleException;
import org.carball.tuner.replica.Replica;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the three tuning stages in order: cluster-and-tune, balance-aware refinement, and load-aware
 * routing. A run either completes or fails as a whole with a {@link TuningException}.
 */
@Slf4j
public class ReplicaTuner implements AutoCloseable {

    private final TuningParameters parameters;
    private final ReplicaWorkers workers;
    private final CostEvaluator evaluator;
    private final PartitionTuner partitionTuner;
    private final BalanceRefiner balanceRefiner;
    private final LoadAwareRouter router;

    public ReplicaTuner(List<Replica> replicas, IndexAdvisor advisor, TuningParameters parameters) {
        parameters.validate();
        this.parameters = parameters;
        this.workers = new ReplicaWorkers(parameters.getParallelism());
        AdvisorBudget budget = new AdvisorBudget(parameters.getSpaceBudgetBytes(), parameters.getMaxIndexWidth());
        this.evaluator = new CostEvaluator(replicas, advisor, budget, workers);
        this.partitionTuner = new PartitionTuner(
                new SimilarityClusterer(parameters.getMaxIndexWidth(), parameters.getParallelism() > 1),
                evaluator, parameters.getMaxTuneIterations());
        this.balanceRefiner = new BalanceRefiner(evaluator, parameters.getMaxRefineIterations());
        this.router = new LoadAwareRouter(evaluator);

        log.info("Initialized ReplicaTuner for {} replicas: {}", replicas.size(), parameters.getConfigurationSummary());
    }

    public TuningResult run(Workload workload) {
        if (workload.isEmpty()) {
            throw new IllegalArgumentException("Workload contains no queries");
        }

        PartitionTuner.Outcome tuned = inStage(TuningStage.CLUSTER_AND_TUNE, () -> partitionTuner.tune(workload));

        Map<String, Double> baseline = inStage(TuningStage.REFINE, () -> evaluator.baselineCosts(workload.getQueries()));
        TuningState refined = inStage(TuningStage.REFINE, () -> balanceRefiner.refine(workload, tuned.best(), baseline));

        RoutingTable routes = inStage(TuningStage.ROUTE,
                () -> router.route(workload, refined.configurations(), baseline, parameters.getThreshold()));

        log.info("Tuning complete: cluster-and-tune cost {}, refined cost {}, routed cost {}",
                tuned.best().totalCost(), refined.totalCost(), routes.totalCost());
        return new TuningResult(tuned.best(), tuned.acceptedCosts(), refined, routes);
    }

    private static <T> T inStage(TuningStage stage, Supplier<T> work) {
        try {
            return work.get();
        } catch (CostOracleException e) {
            log.error("Stage {} failed: {}", stage.getDisplayName(), e.getMessage());
            throw new TuningException(stage, e.getReplicaId(), e.getQueryId(), e.getMessage(), e);
        } catch (IllegalStateException e) {
            log.error("Stage {} failed: {}", stage.getDisplayName(), e.getMessage());
            throw new TuningException(stage, null, null, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        workers.close();
    }
}
