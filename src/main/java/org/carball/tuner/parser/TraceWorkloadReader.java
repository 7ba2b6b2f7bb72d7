package org.carball.tuner.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.model.workload.Workload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a workload from an exported JSON query trace of the form
 * {@code {"queries": [{"query_id": "...", "sql_text": "..."}]}}. Trace order is workload order.
 */
@Slf4j
public class TraceWorkloadReader {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ColumnExtractor extractor;

    public TraceWorkloadReader(ColumnExtractor extractor) {
        this.extractor = extractor;
    }

    public Workload read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Query trace file not found: " + file);
        }
        Workload workload = parse(Files.readString(file));
        log.info("Read {} queries from trace {}", workload.size(), file);
        return workload;
    }

    public Workload parse(String content) throws IOException {
        JsonNode traceData = objectMapper.readTree(content);
        validateTraceFormat(traceData);

        List<Query> queries = new ArrayList<>();
        for (JsonNode queryNode : traceData.get("queries")) {
            queries.add(parseQueryFromJson(queryNode, queries.size() + 1));
        }
        return new Workload(queries);
    }

    private void validateTraceFormat(JsonNode traceData) {
        if (traceData == null || !traceData.isObject()) {
            throw new IllegalStateException("Invalid JSON format in query trace");
        }
        JsonNode queries = traceData.get("queries");
        if (queries == null || !queries.isArray()) {
            throw new IllegalStateException("Missing or invalid queries section in query trace");
        }
    }

    private Query parseQueryFromJson(JsonNode queryNode, int position) {
        JsonNode sqlText = queryNode.get("sql_text");
        if (sqlText == null || sqlText.asText().isBlank()) {
            throw new IllegalStateException("Trace entry " + position + " has no sql_text");
        }
        JsonNode queryId = queryNode.get("query_id");
        String id = queryId == null || queryId.asText().isBlank() ? "q" + position : queryId.asText();
        String sql = sqlText.asText().strip();
        return new Query(id, sql, extractor.extractColumns(sql));
    }
}
