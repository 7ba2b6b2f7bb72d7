package org.carball.tuner.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class TraceWorkloadReaderTest {

    @TempDir
    Path tempDir;

    private TraceWorkloadReader reader;

    @BeforeEach
    void setUp() {
        reader = new TraceWorkloadReader(new ColumnExtractor(Fixtures.schema()));
    }

    @Test
    void shouldReadQueriesInTraceOrder() throws IOException {
        // Given
        String trace = """
                {
                  "queries": [
                    {"query_id": "report-7", "sql_text": "SELECT * FROM orders WHERE status = 'open'"},
                    {"query_id": "lookup-2", "sql_text": "SELECT * FROM customers WHERE region = 'EU'"}
                  ]
                }
                """;

        // When
        Workload workload = reader.parse(trace);

        // Then
        assertThat(workload.getQueries()).extracting(Query::getId).containsExactly("report-7", "lookup-2");
        assertThat(workload.get(0).getColumns()).extracting(Column::getQualifiedName).containsExactly("orders.status");
    }

    @Test
    void shouldNumberEntriesWithoutQueryId() throws IOException {
        String trace = """
                {"queries": [
                  {"query_id": "first", "sql_text": "SELECT 1"},
                  {"sql_text": "SELECT * FROM orders WHERE total > 3"}
                ]}
                """;

        Workload workload = reader.parse(trace);

        assertThat(workload.getQueries()).extracting(Query::getId).containsExactly("first", "q2");
    }

    @Test
    void shouldRejectEntryWithoutSqlText() {
        String trace = """
                {"queries": [{"query_id": "broken"}]}
                """;

        assertThatThrownBy(() -> reader.parse(trace))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("sql_text");
    }

    @Test
    void shouldRejectTraceWithoutQueriesArray() {
        assertThatThrownBy(() -> reader.parse("{\"statements\": []}"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("queries");
        assertThatThrownBy(() -> reader.parse("[1, 2]"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldFailOnMalformedJson() {
        assertThatThrownBy(() -> reader.parse("{\"queries\": ["))
                .isInstanceOf(JsonProcessingException.class);
    }

    @Test
    void shouldReadTraceFile() throws IOException {
        Path file = tempDir.resolve("trace.json");
        Files.writeString(file, "{\"queries\": [{\"query_id\": \"a\", \"sql_text\": \"SELECT * FROM orders WHERE id = 1\"}]}");

        Workload workload = reader.read(file);

        assertThat(workload.size()).isEqualTo(1);
        assertThat(workload.get(0).getColumns()).extracting(Column::getQualifiedName).containsExactly("orders.id");
    }

    @Test
    void shouldFailForMissingTraceFile() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent.json")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }
}
