package org.carball.tuner.tuning;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.tuning.IndexConfigurations;
import org.carball.tuner.model.tuning.Route;
import org.carball.tuner.model.tuning.RoutingTable;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.replica.SimulatedConfiguration;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Benefit-first, load-aware routing. Each query goes to its cheapest replica unless a costlier replica
 * still beats the query's no-index cost and is sufficiently less loaded than the cheapest one.
 * Queries are routed one after another and loads accumulate, so the result depends on workload order.
 */
@Slf4j
public class LoadAwareRouter {

    private final CostEvaluator evaluator;

    public LoadAwareRouter(CostEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /**
     * @param threshold skew tolerance in [0, 1]; 0 always picks the cheapest replica
     */
    public RoutingTable route(Workload workload, IndexConfigurations configurations,
                              Map<String, Double> baseline, double threshold) {
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("Routing threshold must be within [0, 1], got " + threshold);
        }
        log.info("Starting load-aware routing of {} queries with threshold {}", workload.size(), threshold);

        List<String> replicaIds = evaluator.replicaIds();
        List<SimulatedConfiguration> applied = evaluator.apply(configurations);
        List<Query> queries = workload.getQueries();
        double[][] costs = evaluator.costMatrix(applied, queries);

        double[] loads = new double[replicaIds.size()];
        RoutingTable table = new RoutingTable(replicaIds);
        for (int q = 0; q < queries.size(); q++) {
            Query query = queries.get(q);
            double[] queryCosts = column(costs, q);
            int chosen = chooseReplica(queryCosts, loads, baseline.get(query.getId()), threshold);
            table.add(new Route(query.getId(), replicaIds.get(chosen), chosen, queryCosts[chosen]));
            loads[chosen] += queryCosts[chosen];
            log.debug("Routing {} to {}", query, replicaIds.get(chosen));
        }

        log.info("Routed {} queries, load per replica {}", table.size(), table.loadByReplica());
        return table;
    }

    /**
     * Picks a replica for one query. Replicas are visited in ascending cost order and every later
     * replica that beats {@code baseline} while its load ratio to the cheapest replica stays below
     * {@code threshold} takes over the route.
     */
    static int chooseReplica(double[] costs, double[] loads, double baseline, double threshold) {
        int[] order = IntStream.range(0, costs.length)
                .boxed()
                .sorted(Comparator.comparingDouble(r -> costs[r]))
                .mapToInt(Integer::intValue)
                .toArray();

        int cheapest = order[0];
        int route = cheapest;
        for (int k = 1; k < order.length; k++) {
            int candidate = order[k];
            if (costs[candidate] < baseline && loadRatio(loads[candidate], loads[cheapest]) < threshold) {
                route = candidate;
            }
        }
        return route;
    }

    /**
     * Load of a candidate relative to the cheapest replica. Two idle replicas count as balanced (1.0);
     * a loaded candidate against an idle cheapest replica is infinitely skewed.
     */
    static double loadRatio(double candidateLoad, double cheapestLoad) {
        if (cheapestLoad == 0.0) {
            return candidateLoad == 0.0 ? 1.0 : Double.POSITIVE_INFINITY;
        }
        return candidateLoad / cheapestLoad;
    }

    private static double[] column(double[][] matrix, int q) {
        double[] values = new double[matrix.length];
        for (int r = 0; r < matrix.length; r++) {
            values[r] = matrix[r][q];
        }
        return values;
    }
}
