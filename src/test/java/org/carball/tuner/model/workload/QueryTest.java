package org.carball.tuner.model.workload;

import org.carball.tuner.model.schema.DatabaseSchema;
import org.carball.tuner.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class QueryTest {

    private DatabaseSchema schema;

    @BeforeEach
    void setUp() {
        schema = Fixtures.schema();
    }

    @Test
    void shouldSortAndDeduplicateColumns() {
        Query query = Fixtures.query(schema, "q1", "orders.total", "customers.region", "orders.total");

        assertThat(query.getColumns())
                .extracting(c -> c.getQualifiedName())
                .containsExactly("customers.region", "orders.total");
    }

    @Test
    void shouldDeriveCandidateIndexesUpToMaximumWidth() {
        Query query = Fixtures.query(schema, "q1", "orders.status", "orders.total", "orders.customer_id");

        assertThat(query.candidateIndexes(1)).hasSize(3);
        assertThat(query.candidateIndexes(2)).hasSize(6)
                .contains(Fixtures.index(schema, "orders.customer_id", "orders.status"));
        assertThat(query.candidateIndexes(5)).hasSize(7);
    }

    @Test
    void shouldRejectNonPositiveWidth() {
        Query query = Fixtures.query(schema, "q1", "orders.status");

        assertThatThrownBy(() -> query.candidateIndexes(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldComputeJaccardSimilarityOfCandidateSets() {
        Query statusOnly = Fixtures.query(schema, "q1", "orders.status");
        Query statusAndTotal = Fixtures.query(schema, "q2", "orders.status", "orders.total");
        Query region = Fixtures.query(schema, "q3", "customers.region");

        // {status} against {status, total, status+total}
        assertThat(statusOnly.similarity(statusAndTotal, 2)).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(statusOnly.similarity(region, 2)).isZero();
        assertThat(statusOnly.distance(region, 2)).isEqualTo(1.0);
    }

    @Test
    void shouldBeReflexiveAndSymmetric() {
        Query a = Fixtures.query(schema, "q1", "orders.status", "orders.total");
        Query b = Fixtures.query(schema, "q2", "orders.total", "orders.created_at");

        assertThat(a.similarity(a, 2)).isEqualTo(1.0);
        assertThat(a.similarity(b, 2)).isEqualTo(b.similarity(a, 2));
    }

    @Test
    void shouldTreatQueriesWithoutColumnsAsSimilarOnlyWhenTextsMatch() {
        Query first = new Query("q1", "SELECT count(*)  FROM orders", List.of());
        Query sameText = new Query("q2", "select COUNT(*) from orders", List.of());
        Query other = new Query("q3", "SELECT count(*) FROM customers", List.of());

        assertThat(first.candidateIndexes(2)).isEmpty();
        assertThat(first.similarity(sameText, 2)).isEqualTo(1.0);
        assertThat(first.similarity(other, 2)).isZero();
    }

    @Test
    void shouldIdentifyQueriesById() {
        Query query = Fixtures.query(schema, "q7", "orders.status");

        assertThat(query).isEqualTo(new Query("q7", "other text", List.of()));
        assertThat(query).hasToString("q7");
        assertThatThrownBy(() -> new Query(" ", "SELECT 1", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
