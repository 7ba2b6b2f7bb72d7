package org.carball.tuner.tuning;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.carball.tuner.advisor.ExtendIndexAdvisor;
import org.carball.tuner.advisor.InfeasibleBudgetException;
import org.carball.tuner.config.TuningParameters;
import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.model.tuning.TuningResult;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.replica.Replica;
import org.carball.tuner.testing.FakeCostOracle;
import org.carball.tuner.testing.Fixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ReplicaTunerTest {

    private DatabaseSchema schema;
    private FakeCostOracle firstOracle;
    private FakeCostOracle secondOracle;
    private List<Replica> replicas;
    private Workload workload;
    private TuningParameters parameters;

    private ListAppender<ILoggingEvent> listAppender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        schema = Fixtures.schema();
        firstOracle = new FakeCostOracle(schema);
        secondOracle = new FakeCostOracle(schema);
        replicas = List.of(Fixtures.replica("r1", firstOracle), Fixtures.replica("r2", secondOracle));
        workload = new Workload(List.of(
                Fixtures.query(schema, "qa1", "orders.status"),
                Fixtures.query(schema, "qa2", "orders.status"),
                Fixtures.query(schema, "qb1", "customers.region"),
                Fixtures.query(schema, "qb2", "customers.region")));
        parameters = TuningParameters.builder()
                .spaceBudgetBytes(1000)
                .maxIndexWidth(2)
                .threshold(0.5)
                .build();

        logger = (Logger) LoggerFactory.getLogger(CostEvaluator.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        logger.setLevel(Level.DEBUG);
        logger.setAdditive(false);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
        listAppender.stop();
        listAppender.list.clear();
    }

    @Test
    void shouldSpecialiseReplicasAndRouteQueriesToThem() {
        // Given
        TuningResult result;
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(), parameters)) {
            // When
            result = tuner.run(workload);
        }

        // Then
        assertThat(result.clusteredState().totalCost()).isEqualTo(200.0);
        assertThat(result.acceptedTuneCosts()).containsExactly(200.0);
        assertThat(result.refinedState().totalCost()).isEqualTo(200.0);
        assertThat(result.configurations().forReplica("r1")).containsExactly(Fixtures.index(schema, "orders.status"));
        assertThat(result.configurations().forReplica("r2")).containsExactly(Fixtures.index(schema, "customers.region"));

        assertThat(result.routingTable().size()).isEqualTo(4);
        assertThat(result.routingTable().replicaFor("qa1")).isEqualTo("r1");
        assertThat(result.routingTable().replicaFor("qa2")).isEqualTo("r1");
        assertThat(result.routingTable().replicaFor("qb1")).isEqualTo("r2");
        assertThat(result.routingTable().replicaFor("qb2")).isEqualTo("r2");
        assertThat(result.routingTable().totalCost()).isEqualTo(200.0);
    }

    @Test
    void shouldNeverEndWithHigherCostThanClustering() {
        TuningResult result;
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(), parameters)) {
            result = tuner.run(workload);
        }

        assertThat(result.refinedState().totalCost()).isLessThanOrEqualTo(result.clusteredState().totalCost());
        assertThat(result.acceptedTuneCosts()).isSortedAccordingTo((a, b) -> Double.compare(b, a));
    }

    @Test
    void shouldProduceSameResultWhenReplicasAreEvaluatedConcurrently() {
        TuningResult sequential;
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(), parameters)) {
            sequential = tuner.run(workload);
        }

        TuningResult concurrent;
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(),
                parameters.toBuilder().parallelism(2).build())) {
            concurrent = tuner.run(workload);
        }

        assertThat(concurrent.configurations()).isEqualTo(sequential.configurations());
        assertThat(concurrent.routingTable()).isEqualTo(sequential.routingTable());
        assertThat(concurrent.refinedState().totalCost()).isEqualTo(sequential.refinedState().totalCost());
    }

    @Test
    void shouldReportStageReplicaAndQueryWhenOracleFails() {
        // Given
        secondOracle.failOnQuery("qb1");

        // When / Then
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(), parameters)) {
            assertThatThrownBy(() -> tuner.run(workload))
                    .isInstanceOfSatisfying(TuningException.class, e -> {
                        assertThat(e.getStage()).isEqualTo(TuningStage.CLUSTER_AND_TUNE);
                        assertThat(e.getReplicaId()).isEqualTo("r2");
                        assertThat(e.getQueryId()).isEqualTo("qb1");
                        assertThat(e.getMessage()).contains("cluster/tune", "r2", "qb1");
                    });
        }
    }

    @Test
    void shouldRejectEmptyWorkload() {
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(), parameters)) {
            assertThatThrownBy(() -> tuner.run(new Workload(List.of())))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("no queries");
        }
    }

    @Test
    void shouldRejectInvalidParametersBeforeTuning() {
        TuningParameters invalid = parameters.toBuilder().threshold(2.0).build();

        assertThatThrownBy(() -> new ReplicaTuner(replicas, new ExtendIndexAdvisor(), invalid))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Threshold");
    }

    @Test
    void shouldContinueWithoutIndexesWhenBudgetIsInfeasible() {
        // Given
        TuningResult result;
        try (ReplicaTuner tuner = new ReplicaTuner(replicas, (replica, queries, budget) -> {
            throw new InfeasibleBudgetException("no candidate fits in 1000 bytes");
        }, parameters)) {
            // When
            result = tuner.run(workload);
        }

        // Then
        assertThat(result.configurations().forReplica("r1")).isEmpty();
        assertThat(result.configurations().forReplica("r2")).isEmpty();
        assertThat(result.routingTable().size()).isEqualTo(4);
        assertThat(listAppender.list)
                .anyMatch(event -> event.getLevel() == Level.WARN
                        && event.getFormattedMessage().contains("Budget infeasible on replica"));
    }

    @Test
    void shouldCloseWorkersWithoutClosingReplicas() {
        ReplicaTuner tuner = new ReplicaTuner(replicas, new ExtendIndexAdvisor(),
                parameters.toBuilder().parallelism(2).build());

        tuner.close();

        assertThat(firstOracle.isClosed()).isFalse();
        assertThat(secondOracle.isClosed()).isFalse();
    }
}
