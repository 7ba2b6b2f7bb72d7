package org.carball.tuner.replica;

import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.schema.Index;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.testing.FakeCostOracle;
import org.carball.tuner.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReplicaTest {

    private DatabaseSchema schema;
    private FakeCostOracle oracle;
    private Replica replica;
    private Query query;

    @BeforeEach
    void setUp() {
        schema = Fixtures.schema();
        oracle = new FakeCostOracle(schema);
        replica = Fixtures.replica("r1", oracle);
        query = Fixtures.query(schema, "q1", "orders.status");
    }

    @Test
    void shouldReadCostsThroughCurrentConfiguration() {
        Index status = Fixtures.index(schema, "orders.status");

        SimulatedConfiguration bare = replica.reset();
        assertThat(bare.cost(query)).isEqualTo(100.0);

        SimulatedConfiguration indexed = replica.apply(List.of(status));
        assertThat(indexed.cost(query)).isEqualTo(50.0);
        assertThat(indexed.getIndexes()).containsExactly(status);
        assertThat(replica.getConfiguration()).containsExactly(status);
        assertThat(oracle.getActive()).containsExactly(status);
    }

    @Test
    void shouldRejectCostReadsThroughStaleConfiguration() {
        SimulatedConfiguration first = replica.apply(List.of(Fixtures.index(schema, "orders.status")));
        SimulatedConfiguration second = replica.apply(List.of());

        assertThat(first.isCurrent()).isFalse();
        assertThat(second.isCurrent()).isTrue();
        assertThatThrownBy(() -> first.cost(query))
                .isInstanceOf(StaleConfigurationException.class)
                .hasMessageContaining("r1");
        assertThat(second.cost(query)).isEqualTo(100.0);
    }

    @Test
    void shouldAnnotateOracleFailuresWithReplicaAndQuery() {
        oracle.failOnQuery("q1");
        SimulatedConfiguration bare = replica.reset();

        assertThatThrownBy(() -> bare.cost(query))
                .isInstanceOfSatisfying(CostOracleException.class, e -> {
                    assertThat(e.getReplicaId()).isEqualTo("r1");
                    assertThat(e.getQueryId()).isEqualTo("q1");
                    assertThat(e.isTransientFailure()).isFalse();
                    assertThat(e.getMessage()).contains("[replica=r1, query=q1]");
                });
    }

    @Test
    void shouldSumCostsOverQueries() {
        Query other = Fixtures.query(schema, "q2", "customers.region");
        oracle.baseCost("q2", 40.0);

        assertThat(replica.reset().totalCost(List.of(query, other))).isEqualTo(140.0);
    }

    @Test
    void shouldCloseOracle() {
        replica.close();

        assertThat(oracle.isClosed()).isTrue();
    }
}
