package org.carball.tuner.model.workload;

import lombok.AccessLevel;
import lombok.Getter;
import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.Index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A workload statement together with the indexable columns its predicates reference.
 */
@Getter
public class Query {

    private final String id;
    private final String text;
    private final List<Column> columns;

    @Getter(AccessLevel.NONE)
    private final Map<Integer, Set<Index>> candidateCache = new ConcurrentHashMap<>();

    public Query(String id, String text, Collection<Column> columns) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Query id must not be blank");
        }
        this.id = id;
        this.text = text == null ? "" : text;
        this.columns = columns == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(columns)));
    }

    /**
     * Every non-empty combination of this query's columns up to {@code maxWidth} columns, each as an
     * {@link Index} in column order. Computed once per width.
     */
    public Set<Index> candidateIndexes(int maxWidth) {
        if (maxWidth < 1) {
            throw new IllegalArgumentException("Maximum index width must be at least 1, got " + maxWidth);
        }
        return candidateCache.computeIfAbsent(Math.min(maxWidth, Math.max(columns.size(), 1)),
                this::deriveCandidates);
    }

    private Set<Index> deriveCandidates(int width) {
        Set<Index> candidates = new HashSet<>();
        collectCombinations(0, width, new ArrayList<>(), candidates);
        return Collections.unmodifiableSet(candidates);
    }

    private void collectCombinations(int start, int width, List<Column> prefix, Set<Index> out) {
        for (int i = start; i < columns.size(); i++) {
            prefix.add(columns.get(i));
            out.add(new Index(prefix));
            if (prefix.size() < width) {
                collectCombinations(i + 1, width, prefix, out);
            }
            prefix.remove(prefix.size() - 1);
        }
    }

    /**
     * Jaccard similarity of the two queries' candidate index sets. Two queries without any indexable
     * column are similar (1.0) only when their texts match, and dissimilar (0.0) otherwise.
     */
    public double similarity(Query other, int maxWidth) {
        Set<Index> mine = candidateIndexes(maxWidth);
        Set<Index> theirs = other.candidateIndexes(maxWidth);

        if (mine.isEmpty() && theirs.isEmpty()) {
            return normalizedText().equals(other.normalizedText()) ? 1.0 : 0.0;
        }

        Set<Index> smaller = mine.size() <= theirs.size() ? mine : theirs;
        Set<Index> larger = smaller == mine ? theirs : mine;
        long shared = smaller.stream().filter(larger::contains).count();
        long union = mine.size() + theirs.size() - shared;
        return (double) shared / union;
    }

    public double distance(Query other, int maxWidth) {
        return 1.0 - similarity(other, maxWidth);
    }

    private String normalizedText() {
        return text.trim().replaceAll("\\s+", " ").toLowerCase();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Query other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
