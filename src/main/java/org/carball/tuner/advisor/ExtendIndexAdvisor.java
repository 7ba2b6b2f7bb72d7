package org.carball.tuner.advisor;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.replica.Replica;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

/**
 * Greedy, budget-bounded index selection. Each round either adds a single-column index or widens a
 * chosen index by one column of the same table, picking the step with the largest cost reduction per
 * additional byte. Selection stops when no affordable step lowers the workload cost.
 */
@Slf4j
public class ExtendIndexAdvisor implements IndexAdvisor {

    @Override
    public List<Index> recommend(Replica replica, List<Query> queries, AdvisorBudget budget) {
        if (queries.isEmpty()) {
            return List.of();
        }

        Workload workload = new Workload(queries);
        SortedSet<Column> columns = workload.indexableColumns();
        List<Index> singles = workload.potentialIndexes();
        Map<Index, Long> sizes = new HashMap<>();

        List<Index> chosen = new ArrayList<>();
        long usedBytes = 0;
        double currentCost = replica.apply(chosen).totalCost(queries);
        log.debug("Advising replica {} for {} queries, baseline cost {}", replica.getId(), queries.size(), currentCost);

        while (true) {
            Step best = null;

            for (Index single : singles) {
                if (chosen.contains(single) || coveredAsLeadingColumn(chosen, single)) {
                    continue;
                }
                long delta = size(replica, single, sizes);
                if (usedBytes + delta > budget.spaceBudgetBytes()) {
                    continue;
                }
                List<Index> candidate = new ArrayList<>(chosen);
                candidate.add(single);
                best = better(best, evaluate(replica, queries, candidate, currentCost, delta));
            }

            for (Index existing : chosen) {
                if (existing.width() >= budget.maxIndexWidth()) {
                    continue;
                }
                for (Column column : columns) {
                    if (!column.getTable().getName().equals(existing.getTable().getName())
                            || existing.getColumns().contains(column)) {
                        continue;
                    }
                    Index widened = existing.appending(column);
                    if (chosen.contains(widened)) {
                        continue;
                    }
                    long delta = size(replica, widened, sizes) - size(replica, existing, sizes);
                    if (usedBytes + delta > budget.spaceBudgetBytes()) {
                        continue;
                    }
                    List<Index> candidate = new ArrayList<>(chosen);
                    candidate.set(candidate.indexOf(existing), widened);
                    best = better(best, evaluate(replica, queries, candidate, currentCost, delta));
                }
            }

            if (best == null) {
                break;
            }
            chosen = best.configuration();
            usedBytes += best.sizeDelta();
            currentCost = best.cost();
            log.debug("Replica {}: accepted {} (cost {}, {} bytes used)", replica.getId(), chosen, currentCost, usedBytes);
        }

        if (chosen.isEmpty()) {
            log.debug("No affordable index lowers the cost on replica {}", replica.getId());
        }
        return List.copyOf(chosen);
    }

    private static boolean coveredAsLeadingColumn(List<Index> chosen, Index single) {
        return chosen.stream().anyMatch(single::isPrefixOf);
    }

    private static long size(Replica replica, Index index, Map<Index, Long> sizes) {
        return sizes.computeIfAbsent(index, replica::estimateIndexSize);
    }

    private static Step evaluate(Replica replica, List<Query> queries, List<Index> configuration,
                                 double currentCost, long sizeDelta) {
        double cost = replica.apply(configuration).totalCost(queries);
        double benefit = currentCost - cost;
        if (benefit <= 0) {
            return null;
        }
        return new Step(configuration, cost, sizeDelta, benefit / Math.max(sizeDelta, 1L));
    }

    private static Step better(Step current, Step candidate) {
        if (candidate == null) {
            return current;
        }
        if (current == null || candidate.ratio() > current.ratio()) {
            return candidate;
        }
        return current;
    }

    private record Step(List<Index> configuration, double cost, long sizeDelta, double ratio) {}
}
