package org.carball.tuner.model.tuning;

import org.carball.tuner.model.workload.Query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Assignment of queries to replicas, keyed by replica id in replica order. A query may be assigned
 * to more than one replica once it has been duplicated during refinement.
 */
public final class Partition {

    private final Map<String, List<Query>> assignments;

    private Partition(Map<String, List<Query>> assignments) {
        this.assignments = assignments;
    }

    public static Partition empty(List<String> replicaIds) {
        Map<String, List<Query>> assignments = new LinkedHashMap<>();
        for (String replicaId : replicaIds) {
            if (assignments.put(replicaId, new ArrayList<>()) != null) {
                throw new IllegalArgumentException("Duplicate replica id: " + replicaId);
            }
        }
        return new Partition(assignments);
    }

    public static Partition of(List<String> replicaIds, List<List<Query>> groups) {
        if (replicaIds.size() != groups.size()) {
            throw new IllegalArgumentException(
                    "Expected " + replicaIds.size() + " query groups but got " + groups.size());
        }
        Partition partition = empty(replicaIds);
        for (int i = 0; i < groups.size(); i++) {
            for (Query query : groups.get(i)) {
                partition.assign(replicaIds.get(i), query);
            }
        }
        return partition;
    }

    public List<String> replicaIds() {
        return List.copyOf(assignments.keySet());
    }

    public List<Query> queriesOf(String replicaId) {
        return Collections.unmodifiableList(require(replicaId));
    }

    public boolean contains(String replicaId, Query query) {
        return require(replicaId).contains(query);
    }

    /**
     * Adds the query to the replica's list unless it is already there.
     */
    public void assign(String replicaId, Query query) {
        List<Query> queries = require(replicaId);
        if (!queries.contains(query)) {
            queries.add(query);
        }
    }

    public boolean unassign(String replicaId, Query query) {
        return require(replicaId).remove(query);
    }

    public Partition copy() {
        Map<String, List<Query>> copied = new LinkedHashMap<>();
        assignments.forEach((id, queries) -> copied.put(id, new ArrayList<>(queries)));
        return new Partition(copied);
    }

    /**
     * A copy where {@code query} leaves {@code from} and joins {@code to}.
     */
    public Partition withMove(Query query, String from, String to) {
        Partition moved = copy();
        moved.unassign(from, query);
        moved.assign(to, query);
        return moved;
    }

    /**
     * A copy where {@code query} additionally runs on {@code to}.
     */
    public Partition withDuplicate(Query query, String to) {
        Partition duplicated = copy();
        duplicated.assign(to, query);
        return duplicated;
    }

    public int totalAssignments() {
        return assignments.values().stream().mapToInt(List::size).sum();
    }

    private List<Query> require(String replicaId) {
        List<Query> queries = assignments.get(replicaId);
        if (queries == null) {
            throw new IllegalArgumentException("Unknown replica id: " + replicaId);
        }
        return queries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Partition other && assignments.equals(other.assignments);
    }

    @Override
    public int hashCode() {
        return assignments.hashCode();
    }

    @Override
    public String toString() {
        return assignments.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
