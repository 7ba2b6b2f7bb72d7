package org.carball.tuner.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.DatabaseSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the known schema columns referenced by a statement's WHERE predicates.
 */
@Slf4j
public class ColumnExtractor {

    private static final Pattern PREDICATE_PATTERN = Pattern.compile(
            "\\bWHERE\\b(.+?)(?=\\)|\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bHAVING\\b|\\bLIMIT\\b|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final String TABLE_NAME = "([A-Za-z_][A-Za-z0-9_.]*)";

    // an alias never starts a clause, so "FROM orders WHERE" keeps WHERE out of the match
    private static final String ALIAS = "(?:\\s+(?:AS\\s+)?"
            + "(?!(?:WHERE|JOIN|INNER|LEFT|RIGHT|FULL|CROSS|NATURAL|ON|USING|GROUP|ORDER|HAVING|LIMIT|OFFSET|UNION|FOR)\\b)"
            + "[A-Za-z_][A-Za-z0-9_]*)?";

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "\\b(?:FROM|JOIN)\\s+" + TABLE_NAME + ALIAS + "(?:\\s*,\\s*" + TABLE_NAME + ALIAS + ")*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern LIST_ENTRY_PATTERN = Pattern.compile(
            ",\\s*([A-Za-z_][A-Za-z0-9_.]*)");

    private final Map<String, List<Column>> columnsByName = new LinkedHashMap<>();

    public ColumnExtractor(DatabaseSchema schema) {
        for (Column column : schema.getAllColumns()) {
            columnsByName.computeIfAbsent(column.getName(), name -> new ArrayList<>()).add(column);
        }
        log.debug("Column extractor knows {} distinct column names", columnsByName.size());
    }

    public List<Column> extractColumns(String sql) {
        List<String> predicates = extractPredicates(sql);
        if (predicates.isEmpty()) {
            return List.of();
        }

        Set<String> referencedTables = extractTableNames(sql);
        Set<Column> found = new TreeSet<>();
        for (Map.Entry<String, List<Column>> entry : columnsByName.entrySet()) {
            Pattern word = Pattern.compile("\\b" + Pattern.quote(entry.getKey()) + "\\b", Pattern.CASE_INSENSITIVE);
            if (predicates.stream().noneMatch(p -> word.matcher(p).find())) {
                continue;
            }
            found.addAll(resolve(entry.getValue(), referencedTables));
        }
        return new ArrayList<>(found);
    }

    /**
     * A column name that exists in several tables is narrowed to the tables the statement reads from;
     * when none of them is read, every candidate is kept.
     */
    private static List<Column> resolve(List<Column> candidates, Set<String> referencedTables) {
        if (candidates.size() == 1) {
            return candidates;
        }
        List<Column> narrowed = candidates.stream()
                .filter(c -> referencedTables.contains(c.getTable().getName()))
                .toList();
        return narrowed.isEmpty() ? candidates : narrowed;
    }

    static List<String> extractPredicates(String sql) {
        List<String> predicates = new ArrayList<>();
        Matcher matcher = PREDICATE_PATTERN.matcher(sql);
        while (matcher.find()) {
            predicates.add(matcher.group(1));
        }
        return predicates;
    }

    static Set<String> extractTableNames(String sql) {
        Set<String> tables = new TreeSet<>();
        Matcher matcher = TABLE_PATTERN.matcher(sql);
        while (matcher.find()) {
            tables.add(unqualified(matcher.group(1)));
            Matcher entries = LIST_ENTRY_PATTERN.matcher(matcher.group());
            while (entries.find()) {
                tables.add(unqualified(entries.group(1)));
            }
        }
        return tables;
    }

    private static String unqualified(String name) {
        int dot = name.lastIndexOf('.');
        return (dot >= 0 ? name.substring(dot + 1) : name).toLowerCase(Locale.ROOT);
    }
}
