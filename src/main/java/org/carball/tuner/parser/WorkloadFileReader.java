package org.carball.tuner.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.workload.Query;
import org.carball.tuner.model.workload.Workload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a workload from a flat SQL file. Statements are separated by {@code ;}; a file without any
 * separator holds one statement per line. Queries are numbered {@code q1..qN} in file order.
 */
@Slf4j
public class WorkloadFileReader {

    private final ColumnExtractor extractor;

    public WorkloadFileReader(ColumnExtractor extractor) {
        this.extractor = extractor;
    }

    public Workload read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Workload file not found: " + file);
        }
        Workload workload = parse(Files.readString(file));
        log.info("Read {} queries from {}", workload.size(), file);
        return workload;
    }

    public Workload parse(String content) {
        List<Query> queries = new ArrayList<>();
        for (String statement : splitStatements(content)) {
            String id = "q" + (queries.size() + 1);
            Query query = new Query(id, statement, extractor.extractColumns(statement));
            if (query.getColumns().isEmpty()) {
                log.debug("Query {} references no indexable column", id);
            }
            queries.add(query);
        }
        return new Workload(queries);
    }

    static List<String> splitStatements(String rawContent) {
        String content = rawContent.replaceAll("(?m)^\\s*--.*$", "");
        List<String> statements = new ArrayList<>();
        if (!hasSeparator(content)) {
            for (String line : content.split("\\R")) {
                addIfPresent(statements, line);
            }
            return statements;
        }

        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (char c : content.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == ';' && !quoted) {
                addIfPresent(statements, current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(statements, current.toString());
        return statements;
    }

    private static boolean hasSeparator(String content) {
        boolean quoted = false;
        for (char c : content.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            } else if (c == ';' && !quoted) {
                return true;
            }
        }
        return false;
    }

    private static void addIfPresent(List<String> statements, String text) {
        String statement = text.strip();
        if (!statement.isEmpty()) {
            statements.add(statement.replaceAll("\\s+", " "));
        }
    }
}
