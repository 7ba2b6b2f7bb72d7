package org.carball.tuner.parser;

import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.model.workload.Workload;
import org.carball.tuner.testing.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class WorkloadFileReaderTest {

    @TempDir
    Path tempDir;

    private WorkloadFileReader reader;

    @BeforeEach
    void setUp() {
        reader = new WorkloadFileReader(new ColumnExtractor(Fixtures.schema()));
    }

    @Test
    void shouldSplitStatementsOnSemicolons() {
        List<String> statements = WorkloadFileReader.splitStatements("""
                SELECT * FROM orders
                  WHERE status = 'open';
                SELECT * FROM customers WHERE region = 'EU';
                """);

        assertThat(statements).containsExactly(
                "SELECT * FROM orders WHERE status = 'open'",
                "SELECT * FROM customers WHERE region = 'EU'");
    }

    @Test
    void shouldTreatEachLineAsStatementWithoutSeparators() {
        List<String> statements = WorkloadFileReader.splitStatements("""
                SELECT * FROM orders WHERE status = 'open'

                SELECT * FROM customers WHERE region = 'EU'
                """);

        assertThat(statements).hasSize(2);
    }

    @Test
    void shouldKeepSemicolonsInsideStringLiterals() {
        List<String> statements = WorkloadFileReader.splitStatements(
                "SELECT * FROM orders WHERE status = 'a;b'; SELECT * FROM orders WHERE total > 1");

        assertThat(statements).containsExactly(
                "SELECT * FROM orders WHERE status = 'a;b'",
                "SELECT * FROM orders WHERE total > 1");
    }

    @Test
    void shouldSkipCommentLinesAndBlankStatements() {
        List<String> statements = WorkloadFileReader.splitStatements("""
                -- nightly report queries
                SELECT * FROM orders WHERE status = 'open';
                ;
                -- regional lookups
                SELECT * FROM customers WHERE region = 'EU';
                """);

        assertThat(statements).hasSize(2);
        assertThat(statements).noneMatch(s -> s.contains("--"));
    }

    @Test
    void shouldNumberQueriesInFileOrder() {
        // Given
        String content = """
                SELECT * FROM orders WHERE status = 'open';
                SELECT * FROM customers WHERE region = 'EU';
                SELECT count(*) FROM orders;
                """;

        // When
        Workload workload = reader.parse(content);

        // Then
        assertThat(workload.getQueries()).extracting(Query::getId).containsExactly("q1", "q2", "q3");
        assertThat(workload.get(0).getColumns()).extracting(Column::getQualifiedName).containsExactly("orders.status");
        assertThat(workload.get(1).getColumns()).extracting(Column::getQualifiedName).containsExactly("customers.region");
        assertThat(workload.get(2).getColumns()).isEmpty();
    }

    @Test
    void shouldReadWorkloadFile() throws IOException {
        // Given
        Path file = tempDir.resolve("workload.sql");
        Files.writeString(file, "SELECT * FROM orders WHERE total > 10;\nSELECT * FROM orders WHERE status = 'x';\n");

        // When
        Workload workload = reader.read(file);

        // Then
        assertThat(workload.size()).isEqualTo(2);
        assertThat(workload.get(1).getText()).isEqualTo("SELECT * FROM orders WHERE status = 'x'");
    }

    @Test
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("missing.sql")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Workload file not found");
    }
}
