package org.carball.tuner.replica;

import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.testing.FakeCostOracle;
import org.carball.tuner.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RetryingCostOracleTest {

    private static final RetryPolicy NO_WAIT = RetryPolicy.builder()
            .maxAttempts(3)
            .initialBackoff(Duration.ZERO)
            .build();

    private FakeCostOracle delegate;
    private RetryingCostOracle oracle;
    private Query query;

    @BeforeEach
    void setUp() {
        DatabaseSchema schema = Fixtures.schema();
        delegate = new FakeCostOracle(schema);
        oracle = new RetryingCostOracle(delegate, NO_WAIT);
        query = Fixtures.query(schema, "q1", "orders.status");
    }

    @Test
    void shouldRetryTransientFailures() {
        delegate.failNextCostCalls(2, true);

        assertThat(oracle.estimateCost(query)).isEqualTo(100.0);
        assertThat(delegate.getCostCalls()).isEqualTo(3);
    }

    @Test
    void shouldNotRetryPermanentFailures() {
        delegate.failNextCostCalls(1, false);

        assertThatThrownBy(() -> oracle.estimateCost(query))
                .isInstanceOf(CostOracleException.class);
        assertThat(delegate.getCostCalls()).isEqualTo(1);
    }

    @Test
    void shouldRethrowLastFailureWhenAttemptsRunOut() {
        delegate.failNextCostCalls(5, true);

        assertThatThrownBy(() -> oracle.estimateCost(query))
                .isInstanceOfSatisfying(CostOracleException.class,
                        e -> assertThat(e.isTransientFailure()).isTrue());
        assertThat(delegate.getCostCalls()).isEqualTo(3);
    }

    @Test
    void shouldRejectPolicyWithoutAttempts() {
        RetryPolicy none = RetryPolicy.builder().maxAttempts(0).build();

        assertThatThrownBy(() -> new RetryingCostOracle(delegate, none))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldBackOffExponentially() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertThat(policy.backoffBefore(1)).isEqualTo(Duration.ZERO);
        assertThat(policy.backoffBefore(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.backoffBefore(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(RetryPolicy.noRetries().getMaxAttempts()).isEqualTo(1);
    }
}
