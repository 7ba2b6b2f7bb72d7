package org.carball.tuner.model.workload;

import org.carball.tuner.model.schema.Column;
import org.carball.tuner.model.schema.Index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * An ordered collection of queries. Query ids are unique within a workload.
 */
public class Workload implements Iterable<Query> {

    private final List<Query> queries;

    public Workload(List<Query> queries) {
        Set<String> seen = new HashSet<>();
        for (Query query : queries) {
            if (!seen.add(query.getId())) {
                throw new IllegalArgumentException("Duplicate query id in workload: " + query.getId());
            }
        }
        this.queries = Collections.unmodifiableList(new ArrayList<>(queries));
    }

    public List<Query> getQueries() {
        return queries;
    }

    public int size() {
        return queries.size();
    }

    public boolean isEmpty() {
        return queries.isEmpty();
    }

    public Query get(int position) {
        return queries.get(position);
    }

    public SortedSet<Column> indexableColumns() {
        return queries.stream()
                .flatMap(q -> q.getColumns().stream())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * One single-column index per indexable column, sorted.
     */
    public List<Index> potentialIndexes() {
        return indexableColumns().stream()
                .map(Index::of)
                .sorted()
                .collect(Collectors.toList());
    }

    @Override
    public Iterator<Query> iterator() {
        return queries.iterator();
    }

    @Override
    public String toString() {
        return "Workload" + queries;
    }
}
