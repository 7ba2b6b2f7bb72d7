package org.carball.tuner.replica;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

/**
 * Retries transient failures of a delegate oracle. Permanent failures, and the last transient failure
 * once attempts are exhausted, propagate to the caller.
 */
@Slf4j
public class RetryingCostOracle implements CostOracle {

    private final CostOracle delegate;
    private final RetryPolicy policy;

    public RetryingCostOracle(CostOracle delegate, RetryPolicy policy) {
        if (policy.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("Retry policy needs at least one attempt");
        }
        this.delegate = delegate;
        this.policy = policy;
    }

    @Override
    public void applyConfiguration(List<Index> indexes) {
        withRetries("apply configuration", () -> {
            delegate.applyConfiguration(indexes);
            return null;
        });
    }

    @Override
    public double estimateCost(Query query) {
        return withRetries("estimate cost of " + query.getId(), () -> delegate.estimateCost(query));
    }

    @Override
    public long estimateIndexSize(Index index) {
        return withRetries("estimate size of " + index, () -> delegate.estimateIndexSize(index));
    }

    @Override
    public DatabaseSchema listColumns() {
        return withRetries("list columns", delegate::listColumns);
    }

    @Override
    public void close() {
        delegate.close();
    }

    private <T> T withRetries(String operation, Supplier<T> call) {
        CostOracleException lastFailure = null;
        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            pause(policy.backoffBefore(attempt));
            try {
                return call.get();
            } catch (CostOracleException e) {
                if (!e.isTransientFailure()) {
                    throw e;
                }
                lastFailure = e;
                log.warn("Attempt {}/{} to {} failed: {}", attempt, policy.getMaxAttempts(), operation, e.getMessage());
            }
        }
        throw lastFailure;
    }

    private void pause(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CostOracleException("Interrupted while backing off", e, false);
        }
    }
}
