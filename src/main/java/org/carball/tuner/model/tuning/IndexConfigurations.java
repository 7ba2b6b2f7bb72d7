package org.carball.tuner.model.tuning;

import org.carball.tuner.model.schema.Index;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One index configuration per replica, in replica order.
 */
public final class IndexConfigurations {

    private final Map<String, List<Index>> byReplica;

    private IndexConfigurations(Map<String, List<Index>> byReplica) {
        this.byReplica = byReplica;
    }

    public static IndexConfigurations of(Map<String, List<Index>> byReplica) {
        Map<String, List<Index>> copied = new LinkedHashMap<>();
        byReplica.forEach((id, indexes) -> copied.put(id, List.copyOf(indexes)));
        return new IndexConfigurations(Collections.unmodifiableMap(copied));
    }

    public static IndexConfigurations empty(List<String> replicaIds) {
        Map<String, List<Index>> none = new LinkedHashMap<>();
        replicaIds.forEach(id -> none.put(id, List.of()));
        return of(none);
    }

    public List<Index> forReplica(String replicaId) {
        List<Index> indexes = byReplica.get(replicaId);
        if (indexes == null) {
            throw new IllegalArgumentException("No configuration for replica " + replicaId);
        }
        return indexes;
    }

    public List<String> replicaIds() {
        return List.copyOf(byReplica.keySet());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof IndexConfigurations other && byReplica.equals(other.byReplica);
    }

    @Override
    public int hashCode() {
        return byReplica.hashCode();
    }

    @Override
    public String toString() {
        return byReplica.toString();
    }
}
