package org.carball.tuner.advisor;

import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.replica.Replica;

import java.util.List;

/**
 * Recommends an index configuration for the queries a replica will serve.
 * <p>
 * Advisors may reconfigure the replica while they evaluate candidates; callers must apply the
 * returned configuration themselves before reading costs.
 */
public interface IndexAdvisor {

    /**
     * @return the recommended indexes, or an empty list when nothing fits the budget
     * @throws InfeasibleBudgetException if the advisor prefers to signal an unusable budget explicitly
     */
    List<Index> recommend(Replica replica, List<Query> queries, AdvisorBudget budget);
}
