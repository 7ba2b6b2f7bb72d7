package org.carball.tuner.model.schema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An ordered, deduplicated sequence of columns. This is the vocabulary exchanged with index advisors
 * and cost oracles; equality and ordering follow the column sequence.
 */
public final class Index implements Comparable<Index> {

    private final List<Column> columns;

    public Index(List<Column> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new IllegalArgumentException("Index requires at least one column");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(columns)));
    }

    public static Index of(Column... columns) {
        return new Index(Arrays.asList(columns));
    }

    public List<Column> getColumns() {
        return columns;
    }

    public int width() {
        return columns.size();
    }

    public Column leadingColumn() {
        return columns.get(0);
    }

    public boolean isSingleTable() {
        return columns.stream().map(Column::getTable).distinct().count() == 1;
    }

    /**
     * The table this index would be built on. Only meaningful for single-table indexes.
     */
    public Table getTable() {
        if (!isSingleTable()) {
            throw new IllegalStateException("Index " + this + " spans several tables");
        }
        return leadingColumn().getTable();
    }

    /**
     * Returns a wider index with {@code column} appended, or this index when it already contains it.
     */
    public Index appending(Column column) {
        if (columns.contains(column)) {
            return this;
        }
        List<Column> extended = new ArrayList<>(columns);
        extended.add(column);
        return new Index(extended);
    }

    public boolean isPrefixOf(Index other) {
        return other.columns.size() >= columns.size()
                && other.columns.subList(0, columns.size()).equals(columns);
    }

    @Override
    public int compareTo(Index other) {
        int shared = Math.min(columns.size(), other.columns.size());
        for (int i = 0; i < shared; i++) {
            int cmp = columns.get(i).compareTo(other.columns.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(columns.size(), other.columns.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Index other && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "I(" + columns.stream().map(Column::toString).collect(Collectors.joining(",")) + ")";
    }
}
